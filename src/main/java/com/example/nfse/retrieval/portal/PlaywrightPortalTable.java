package com.example.nfse.retrieval.portal;

import com.example.nfse.retrieval.config.PortalProperties;
import com.example.nfse.retrieval.support.PortalTimeoutException;
import com.example.nfse.retrieval.support.RetrievalException;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitForSelectorState;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

@Slf4j
class PlaywrightPortalTable implements PortalTable {

    private static final String OUTER_HTML = "e => e.outerHTML";
    private static final String PARENT_DISABLED = "e => { const p = e.parentElement;"
            + " return !!p && (p.hasAttribute('disabled') || p.classList.contains('disabled')); }";

    private final Page page;
    private final PortalProperties portal;
    private final int actionColumn;
    private final Duration actionDelay;
    private boolean sorted;

    PlaywrightPortalTable(Page page, PortalProperties portal, int actionColumn, Duration actionDelay) {
        this.page = page;
        this.portal = portal;
        this.actionColumn = actionColumn;
        this.actionDelay = actionDelay;
    }

    @Override
    public boolean awaitRows() {
        try {
            page.waitForSelector(portal.getRowSelector(), new Page.WaitForSelectorOptions()
                    .setState(WaitForSelectorState.ATTACHED)
                    .setTimeout(portal.getTableTimeout().toMillis()));
        } catch (TimeoutError ex) {
            log.info("No rows rendered within {} ms url={}", portal.getTableTimeout().toMillis(), page.url());
            return false;
        } catch (PlaywrightException ex) {
            throw new RetrievalException("Could not read the notes table: " + ex.getMessage(), ex);
        }
        if (!sorted) {
            sorted = true;
            sortByPeriod();
        }
        return true;
    }

    @Override
    public int rowCount() {
        try {
            return rows().count();
        } catch (PlaywrightException ex) {
            throw new RetrievalException("Could not count table rows: " + ex.getMessage(), ex);
        }
    }

    @Override
    public Element row(int index) {
        try {
            return snapshot(rows().nth(index));
        } catch (PlaywrightException ex) {
            throw new RetrievalException("Could not read row %d: %s".formatted(index + 1, ex.getMessage()), ex);
        }
    }

    @Override
    public Element openActionMenu(int index) {
        Locator row = rows().nth(index);
        Locator icon = row.locator("td").nth(actionColumn).locator(portal.getActionIconSelector()).first();
        double timeout = portal.getMenuTimeout().toMillis();
        try {
            icon.click(new Locator.ClickOptions().setTimeout(timeout));
            row.locator(portal.getMenuContainerSelector()).first().waitFor(new Locator.WaitForOptions()
                    .setState(WaitForSelectorState.VISIBLE)
                    .setTimeout(timeout));
        } catch (TimeoutError ex) {
            throw new PortalTimeoutException("action menu of row %d".formatted(index + 1),
                    portal.getMenuTimeout(), ex);
        } catch (PlaywrightException ex) {
            throw new RetrievalException("Could not open action menu of row %d: %s".formatted(index + 1,
                    ex.getMessage()), ex);
        }
        Element snapshot;
        try {
            snapshot = snapshot(row);
        } catch (PlaywrightException ex) {
            throw new RetrievalException("Could not read action menu of row %d".formatted(index + 1), ex);
        }
        try {
            icon.click(new Locator.ClickOptions().setTimeout(timeout));
        } catch (PlaywrightException ex) {
            log.debug("Action menu of row {} did not close: {}", index + 1, ex.getMessage());
        }
        pause();
        return snapshot;
    }

    @Override
    public boolean nextPage() {
        Locator next = page.locator(portal.getNextPageSelector()).first();
        try {
            if (next.count() == 0 || Boolean.TRUE.equals(next.evaluate(PARENT_DISABLED))) {
                return false;
            }
            next.click(new Locator.ClickOptions().setTimeout(portal.getNavigationTimeout().toMillis()));
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions()
                    .setTimeout(portal.getNavigationTimeout().toMillis()));
        } catch (TimeoutError ex) {
            throw new PortalTimeoutException("next page", portal.getNavigationTimeout(), ex);
        } catch (PlaywrightException ex) {
            throw new RetrievalException("Could not turn the page: " + ex.getMessage(), ex);
        }
        pause();
        return true;
    }

    private void sortByPeriod() {
        Locator header = page.locator(portal.getSortHeaderSelector()).first();
        try {
            if (header.count() == 0) {
                log.debug("Sort header {} not present", portal.getSortHeaderSelector());
                return;
            }
            header.click(new Locator.ClickOptions().setTimeout(portal.getMenuTimeout().toMillis()));
            pause();
        } catch (PlaywrightException ex) {
            log.warn("Could not sort table by period: {}", ex.getMessage());
        }
    }

    private Locator rows() {
        return page.locator(portal.getRowSelector());
    }

    private static Element snapshot(Locator row) {
        String html = (String) row.evaluate(OUTER_HTML);
        return Jsoup.parse("<table><tbody>" + html + "</tbody></table>").selectFirst("tr");
    }

    private void pause() {
        if (!actionDelay.isZero()) {
            page.waitForTimeout(actionDelay.toMillis());
        }
    }
}
