package com.privacy.signalaudit.session.playwright;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import com.privacy.signalaudit.config.ScanConfig;
import com.privacy.signalaudit.model.ConsentAction;
import com.privacy.signalaudit.model.SignalConfig;
import com.privacy.signalaudit.session.BrowserException;
import com.privacy.signalaudit.session.BrowsingSession;
import com.privacy.signalaudit.session.NavigationException;
import com.privacy.signalaudit.session.PageObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

class PlaywrightBrowsingSession implements BrowsingSession {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowsingSession.class);

    private static final long SCROLL_PAUSE_MS = 300;

    private final SignalConfig config;
    private final Playwright playwright;
    private final Browser browser;
    private final Page page;
    private final PageInspector inspector;
    private final ScanConfig scanConfig;

    PlaywrightBrowsingSession(SignalConfig config, Playwright playwright, Browser browser, Page page,
                              PageInspector inspector, ScanConfig scanConfig) {
        this.config = config;
        this.playwright = playwright;
        this.browser = browser;
        this.page = page;
        this.inspector = inspector;
        this.scanConfig = scanConfig;
    }

    @Override
    public PageObservation visit(String url, Duration timeout) throws NavigationException {
        try {
            page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(timeout.toMillis()));
        } catch (TimeoutError e) {
            throw new NavigationException("Timeout " + timeout.toMillis() + "ms exceeded", true, e);
        } catch (PlaywrightException e) {
            if (page.isClosed() || !browser.isConnected()) {
                throw new BrowserException("Browser context lost while loading " + url, e);
            }
            throw new NavigationException(firstLine(e.getMessage()), false, e);
        }

        try {
            settle();
            scroll();
            // Inspect before rejecting: the click usually hides the banner
            boolean bannerPresent = inspector.hasConsentBanner(page);
            boolean optOutLinkPresent = inspector.hasOptOutLink(page);
            ConsentAction consentAction = ConsentAction.NOT_ATTEMPTED;
            if (config.isSimulateRejectAction()) {
                consentAction = inspector.rejectConsent(page);
            }
            return PageObservation.builder()
                    .cookieBannerPresent(bannerPresent)
                    .optOutLinkPresent(optOutLinkPresent)
                    .consentAction(consentAction)
                    .build();
        } catch (PlaywrightException e) {
            if (page.isClosed() || !browser.isConnected()) {
                throw new BrowserException("Browser context lost while inspecting " + url, e);
            }
            throw new NavigationException("Page inspection failed: " + firstLine(e.getMessage()), false, e);
        }
    }

    private void settle() {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE,
                    new Page.WaitForLoadStateOptions().setTimeout(scanConfig.getSettleTimeoutMs()));
        } catch (TimeoutError e) {
            // Long-polling pages never go idle; carry on with what has loaded
            log.debug("Session {}: network not idle after {}ms on {}", config.getLabel(),
                    scanConfig.getSettleTimeoutMs(), page.url());
        }
    }

    private void scroll() {
        for (int step = 0; step < scanConfig.getScrollSteps(); step++) {
            page.evaluate("window.scrollBy(0, window.innerHeight * 0.8)");
            page.waitForTimeout(SCROLL_PAUSE_MS);
        }
        page.evaluate("window.scrollTo(0, 0)");
        page.waitForTimeout(scanConfig.getActionDelayMs());
    }

    @Override
    public void close() {
        try {
            playwright.close();
            log.debug("Closed browser for session {}", config.getLabel());
        } catch (PlaywrightException e) {
            log.warn("Error closing browser for session {}: {}", config.getLabel(), e.getMessage());
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "navigation failed";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
