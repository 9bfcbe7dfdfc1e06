package com.privacy.signalaudit.session.playwright;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.privacy.signalaudit.config.InspectionConfig;
import com.privacy.signalaudit.config.ScanConfig;
import com.privacy.signalaudit.model.SignalConfig;
import com.privacy.signalaudit.session.BrowserEngine;
import com.privacy.signalaudit.session.BrowserException;
import com.privacy.signalaudit.session.BrowsingSession;
import com.privacy.signalaudit.session.RequestListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Headless Chromium via Playwright. Playwright objects are not thread-safe,
 * so every session gets its own Playwright instance, browser and context,
 * created on the thread that drives the session.
 */
@Component
public class PlaywrightBrowserEngine implements BrowserEngine {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserEngine.class);

    private final ScanConfig scanConfig;
    private final InspectionConfig inspectionConfig;

    public PlaywrightBrowserEngine(ScanConfig scanConfig, InspectionConfig inspectionConfig) {
        this.scanConfig = scanConfig;
        this.inspectionConfig = inspectionConfig;
    }

    @Override
    public BrowsingSession open(SignalConfig config, RequestListener listener) {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(scanConfig.isHeadless()));

            Browser.NewContextOptions options = new Browser.NewContextOptions()
                    .setIgnoreHTTPSErrors(true);
            if (!config.getHttpHeaders().isEmpty()) {
                options.setExtraHTTPHeaders(config.getHttpHeaders());
            }
            BrowserContext context = browser.newContext(options);
            for (String script : config.getScriptOverrides()) {
                context.addInitScript(script);
            }
            context.onRequest(request -> listener.onRequest(request.url(), request.method(), request.resourceType()));

            log.info("Opened browser context for session {} (headers={}, scripts={}, rejectAction={})",
                    config.getLabel(), config.getHttpHeaders().keySet(), config.getScriptOverrides().size(),
                    config.isSimulateRejectAction());
            return new PlaywrightBrowsingSession(config, playwright, browser, context.newPage(),
                    new PageInspector(inspectionConfig, scanConfig.getActionDelayMs()), scanConfig);
        } catch (PlaywrightException e) {
            if (playwright != null) {
                closeQuietly(playwright, config.getLabel());
            }
            throw new BrowserException("Could not launch browser for session " + config.getLabel()
                    + ": " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Playwright playwright, String label) {
        try {
            playwright.close();
        } catch (PlaywrightException e) {
            log.warn("Failed to close Playwright after launch failure in session {}: {}", label, e.getMessage());
        }
    }
}
