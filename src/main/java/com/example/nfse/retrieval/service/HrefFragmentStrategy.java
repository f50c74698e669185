package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.model.DocumentCategory;
import java.util.Map;
import java.util.Optional;
import org.jsoup.nodes.Element;

class HrefFragmentStrategy implements LinkStrategy {

    private final Map<DocumentCategory, String> fragments;

    HrefFragmentStrategy(Map<DocumentCategory, String> fragments) {
        this.fragments = Map.copyOf(fragments);
    }

    @Override
    public String name() {
        return "href-fragment";
    }

    @Override
    public Optional<String> find(Element row, DocumentCategory category) {
        String fragment = fragments.get(category);
        if (fragment == null || fragment.isBlank()) {
            return Optional.empty();
        }
        return row.select("a[href]").stream()
                .map(anchor -> anchor.attr("href").trim())
                .filter(href -> href.contains(fragment))
                .findFirst();
    }
}
