package com.example.nfse.retrieval.support;

import com.example.nfse.retrieval.model.DocumentCategory;
import java.util.List;

public class LinkNotFoundException extends RetrievalException {

    private final DocumentCategory category;
    private final List<String> attemptedStrategies;

    public LinkNotFoundException(DocumentCategory category, List<String> attemptedStrategies) {
        super("No %s link found after trying %s".formatted(category.label(), attemptedStrategies));
        this.category = category;
        this.attemptedStrategies = List.copyOf(attemptedStrategies);
    }

    public DocumentCategory getCategory() {
        return category;
    }

    public List<String> getAttemptedStrategies() {
        return attemptedStrategies;
    }
}
