package com.example.nfse.retrieval.portal;

import com.example.nfse.retrieval.config.PortalProperties;
import com.example.nfse.retrieval.model.Direction;
import com.example.nfse.retrieval.support.AuthenticationFailedException;
import com.example.nfse.retrieval.support.PortalTimeoutException;
import com.example.nfse.retrieval.support.RetrievalException;
import com.microsoft.playwright.APIResponse;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.RequestOptions;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class PlaywrightPortalSession implements PortalSession {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final PortalProperties portal;
    private final Duration actionDelay;

    PlaywrightPortalSession(Playwright playwright,
            Browser browser,
            BrowserContext context,
            Page page,
            PortalProperties portal,
            Duration actionDelay) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
        this.portal = portal;
        this.actionDelay = actionDelay;
    }

    @Override
    public SessionFacts authenticate() {
        Duration timeout = portal.getAuthenticationTimeout();
        try {
            page.navigate(portal.getBaseUrl(), new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
                    .setTimeout(timeout.toMillis()));
        } catch (TimeoutError ex) {
            throw new PortalTimeoutException("portal home page", timeout, ex);
        } catch (PlaywrightException ex) {
            throw new AuthenticationFailedException("Could not reach %s: %s".formatted(portal.getBaseUrl(),
                    ex.getMessage()), ex);
        }

        Locator login = firstPresent(portal.getLoginSelectors());
        Locator dashboard = firstPresent(portal.getDashboardSelectors());
        if (login != null && dashboard == null) {
            log.info("Certificate login button found url={}", page.url());
            try {
                login.click(new Locator.ClickOptions().setTimeout(timeout.toMillis()));
                awaitDashboard(timeout);
            } catch (TimeoutError ex) {
                throw new PortalTimeoutException("dashboard after certificate login", timeout, ex);
            } catch (PlaywrightException ex) {
                throw new AuthenticationFailedException("Certificate login failed: " + ex.getMessage(), ex);
            }
            if (firstPresent(portal.getDashboardSelectors()) == null
                    && firstPresent(portal.getLoginSelectors()) != null) {
                throw new AuthenticationFailedException(
                        "Portal still shows the certificate login after submitting the certificate");
            }
        } else if (dashboard == null) {
            log.warn("Neither login nor dashboard markers found url={} title={}", page.url(), page.title());
        }

        SessionFacts facts = new SessionFacts(page.url(), page.title());
        log.info("Authenticated url={} title={}", facts.url(), facts.title());
        return facts;
    }

    @Override
    public PortalTable openTable(Direction direction) {
        String selector = direction == Direction.OUTGOING
                ? portal.getOutgoingMenuSelector()
                : portal.getIncomingMenuSelector();
        int actionColumn = direction == Direction.OUTGOING
                ? portal.getOutgoingActionColumn()
                : portal.getIncomingActionColumn();
        Duration timeout = portal.getNavigationTimeout();
        try {
            page.locator(selector).first().click(new Locator.ClickOptions().setTimeout(timeout.toMillis()));
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions()
                    .setTimeout(timeout.toMillis()));
        } catch (TimeoutError ex) {
            throw new PortalTimeoutException("%s menu".formatted(direction.folderName()), timeout, ex);
        } catch (PlaywrightException ex) {
            throw new RetrievalException("Could not open the %s table: %s".formatted(direction.folderName(),
                    ex.getMessage()), ex);
        }
        log.info("Opened {} table url={}", direction.folderName(), page.url());
        return new PlaywrightPortalTable(page, portal, actionColumn, actionDelay);
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public String title() {
        return page.title();
    }

    @Override
    public SessionResponse get(URI uri, Duration timeout) {
        APIResponse response;
        try {
            response = page.request().get(uri.toString(), RequestOptions.create().setTimeout(timeout.toMillis()));
        } catch (TimeoutError ex) {
            throw new PortalTimeoutException("GET %s".formatted(uri), timeout, ex);
        } catch (PlaywrightException ex) {
            throw new RetrievalException("Request to %s failed: %s".formatted(uri, ex.getMessage()), ex);
        }
        try {
            return new SessionResponse(response.status(), response.headers(), response.body());
        } finally {
            response.dispose();
        }
    }

    @Override
    public void close() {
        closeQuietly("context", context::close);
        closeQuietly("browser", browser::close);
        closeQuietly("playwright", playwright::close);
    }

    private void awaitDashboard(Duration timeout) {
        try {
            page.waitForSelector("text=Dashboard", new Page.WaitForSelectorOptions()
                    .setState(WaitForSelectorState.VISIBLE)
                    .setTimeout(timeout.toMillis()));
        } catch (TimeoutError ex) {
            log.debug("Dashboard text not visible yet, waiting for network idle instead");
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions()
                    .setTimeout(timeout.toMillis()));
        }
    }

    private Locator firstPresent(List<String> selectors) {
        for (String selector : selectors) {
            try {
                Locator candidate = page.locator(selector).first();
                if (candidate.count() > 0) {
                    log.debug("Matched selector {}", selector);
                    return candidate;
                }
            } catch (PlaywrightException ex) {
                log.debug("Selector {} rejected: {}", selector, ex.getMessage());
            }
        }
        return null;
    }

    private static void closeQuietly(String what, Runnable closer) {
        try {
            closer.run();
        } catch (PlaywrightException ex) {
            log.warn("Failed to close {}: {}", what, ex.getMessage());
        }
    }
}
