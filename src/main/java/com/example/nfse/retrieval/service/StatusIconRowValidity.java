package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.config.PortalProperties;
import java.util.List;
import java.util.Locale;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * A row is invalid when the status icon's alt or src mentions one of the
 * configured markers (cancelled, invalid). Rows without an icon count as valid.
 */
@Component
public class StatusIconRowValidity implements RowValidity {

    private final int statusColumn;
    private final List<String> markers;

    public StatusIconRowValidity(PortalProperties portal) {
        this.statusColumn = portal.getStatusColumn();
        this.markers = portal.getInvalidStatusMarkers().stream()
                .map(marker -> marker.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public boolean isValid(Element row) {
        List<Element> cells = TableScanner.cells(row);
        if (statusColumn >= cells.size()) {
            return true;
        }
        Element icon = cells.get(statusColumn).selectFirst("img");
        if (icon == null) {
            return true;
        }
        String alt = icon.attr("alt").toLowerCase(Locale.ROOT);
        String src = icon.attr("src").toLowerCase(Locale.ROOT);
        return markers.stream().noneMatch(marker -> alt.contains(marker) || src.contains(marker));
    }
}
