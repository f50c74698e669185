package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.config.PortalProperties;
import com.example.nfse.retrieval.model.DocumentCategory;
import com.example.nfse.retrieval.support.LinkNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Finds the download reference of a row by trying, in order, the href
 * fragment, the visible label and the position inside the action menu.
 * The first strategy with a match wins.
 */
@Slf4j
@Component
public class LinkResolver {

    private final List<LinkStrategy> strategies;

    public LinkResolver(PortalProperties portal) {
        this.strategies = List.of(
                new HrefFragmentStrategy(Map.of(
                        DocumentCategory.PRIMARY, portal.getPrimaryHrefFragment(),
                        DocumentCategory.COMPANION, portal.getCompanionHrefFragment())),
                new LabelTextStrategy(Map.of(
                        DocumentCategory.PRIMARY, portal.getPrimaryLabel(),
                        DocumentCategory.COMPANION, portal.getCompanionLabel())),
                new MenuPositionStrategy(portal.getMenuContainerSelector(), Map.of(
                        DocumentCategory.PRIMARY, portal.getPrimaryMenuOffset(),
                        DocumentCategory.COMPANION, portal.getCompanionMenuOffset())));
    }

    public ResolvedLink resolve(Element row, DocumentCategory category) {
        List<String> attempted = new ArrayList<>(strategies.size());
        for (LinkStrategy strategy : strategies) {
            attempted.add(strategy.name());
            Optional<String> reference = strategy.find(row, category);
            if (reference.isPresent()) {
                log.debug("Resolved {} link via {}: {}", category.label(), strategy.name(), reference.get());
                return new ResolvedLink(reference.get(), strategy.name());
            }
        }
        throw new LinkNotFoundException(category, attempted);
    }
}
