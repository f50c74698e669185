package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.model.DocumentCategory;
import java.util.Optional;
import org.jsoup.nodes.Element;

/** A pure lookup of a download reference inside a row snapshot. */
interface LinkStrategy {

    String name();

    Optional<String> find(Element row, DocumentCategory category);
}
