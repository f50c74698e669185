package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.model.DocumentCategory;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jsoup.nodes.Element;

/** Falls back to the Nth link of the row's action menu. */
class MenuPositionStrategy implements LinkStrategy {

    private final String menuSelector;
    private final Map<DocumentCategory, Integer> offsets;

    MenuPositionStrategy(String menuSelector, Map<DocumentCategory, Integer> offsets) {
        this.menuSelector = menuSelector;
        this.offsets = Map.copyOf(offsets);
    }

    @Override
    public String name() {
        return "menu-position";
    }

    @Override
    public Optional<String> find(Element row, DocumentCategory category) {
        Integer offset = offsets.get(category);
        Element menu = row.selectFirst(menuSelector);
        if (offset == null || offset < 0 || menu == null) {
            return Optional.empty();
        }
        List<String> hrefs = menu.select("a[href]").stream()
                .map(anchor -> anchor.attr("href").trim())
                .filter(href -> !href.isEmpty() && !href.startsWith("#"))
                .toList();
        return offset < hrefs.size() ? Optional.of(hrefs.get(offset)) : Optional.empty();
    }
}
