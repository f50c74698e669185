package com.example.nfse.retrieval.service;

import org.jsoup.nodes.Element;

@FunctionalInterface
public interface RowValidity {

    boolean isValid(Element row);
}
