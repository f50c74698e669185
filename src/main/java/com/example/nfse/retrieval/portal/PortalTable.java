package com.example.nfse.retrieval.portal;

import org.jsoup.nodes.Element;

/**
 * The paginated notes table of one direction. Rows are handed out as Jsoup
 * snapshots so that link and validity rules run without a browser.
 */
public interface PortalTable {

    /** Waits for the current page to render rows; {@code false} when none appear in time. */
    boolean awaitRows();

    int rowCount();

    /** Snapshot of the {@code tr} at {@code index} on the current page. */
    Element row(int index);

    /** Opens the row's action menu and returns the row snapshot with the menu expanded. */
    Element openActionMenu(int index);

    /** Moves to the next page; {@code false} when the pager is missing or disabled. */
    boolean nextPage();
}
