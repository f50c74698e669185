package com.example.nfse.retrieval.portal;

import com.example.nfse.retrieval.config.AutomationProperties;
import com.example.nfse.retrieval.config.PortalProperties;
import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.support.RetrievalException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.ClientCertificate;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Launches one Chromium per job with the company's A1 certificate attached
 * to the browser context. Playwright objects are thread-confined, so every
 * session owns its own {@link Playwright} instance.
 */
@Slf4j
@Component
public class PlaywrightSessionFactory implements PortalSessionFactory {

    private final AutomationProperties automation;
    private final PortalProperties portal;
    private final CredentialProvider credentials;
    private final LaunchGate launchGate;

    public PlaywrightSessionFactory(AutomationProperties automation,
            PortalProperties portal,
            CredentialProvider credentials) {
        this.automation = automation;
        this.portal = portal;
        this.credentials = credentials;
        this.launchGate = new LaunchGate(automation.getBrowserLaunchDelay());
    }

    @Override
    public PortalSession open(Company company, boolean headless) {
        PortalCredential credential = credentials.credentialFor(company);
        launchGate.awaitTurn();

        Playwright playwright;
        try {
            playwright = Playwright.create();
        } catch (PlaywrightException ex) {
            throw new RetrievalException("Failed to start Playwright: " + ex.getMessage(), ex);
        }
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                    .setIgnoreHTTPSErrors(true)
                    .setAcceptDownloads(true)
                    .setViewportSize(automation.viewportWidth(), automation.viewportHeight())
                    .setClientCertificates(List.of(new ClientCertificate(portal.getCertificateOrigin())
                            .setPfxPath(credential.pfxPath())
                            .setPassphrase(credential.passphrase()))));
            context.setDefaultTimeout(portal.getNavigationTimeout().toMillis());
            Page page = context.newPage();
            log.info("Launched browser company={} headless={} viewport={}x{}",
                    company.getId(), headless, automation.viewportWidth(), automation.viewportHeight());
            return new PlaywrightPortalSession(playwright, browser, context, page, portal, automation.getMinActionDelay());
        } catch (PlaywrightException ex) {
            playwright.close();
            throw new RetrievalException("Failed to launch browser for company %s".formatted(company.getId()), ex);
        }
    }
}
