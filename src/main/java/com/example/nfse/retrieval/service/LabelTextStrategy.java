package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.model.DocumentCategory;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.jsoup.nodes.Element;

class LabelTextStrategy implements LinkStrategy {

    private final Map<DocumentCategory, String> labels;

    LabelTextStrategy(Map<DocumentCategory, String> labels) {
        this.labels = Map.copyOf(labels);
    }

    @Override
    public String name() {
        return "label-text";
    }

    @Override
    public Optional<String> find(Element row, DocumentCategory category) {
        String label = labels.get(category);
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String wanted = normalize(label);
        return row.select("a[href]").stream()
                .filter(anchor -> normalize(anchor.text()).equals(wanted)
                        || normalize(anchor.attr("title")).equals(wanted))
                .map(anchor -> anchor.attr("href").trim())
                .filter(href -> !href.isEmpty() && !href.startsWith("#") && !href.startsWith("javascript:"))
                .findFirst();
    }

    static String normalize(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }
}
