package com.privacy.signalaudit.session.playwright;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.AriaRole;
import com.privacy.signalaudit.config.InspectionConfig;
import com.privacy.signalaudit.model.ConsentAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * DOM checks run on a loaded page: consent banner, opt-out link and the
 * simulated "reject" click.
 */
class PageInspector {

    private static final Logger log = LoggerFactory.getLogger(PageInspector.class);

    private static final String LINK_TEXTS_SCRIPT =
            "() => Array.from(document.querySelectorAll('a, button'))"
                    + ".map(e => (e.innerText || e.textContent || '').trim().toLowerCase())"
                    + ".filter(t => t.length > 0)";

    private static final double CLICK_TIMEOUT_MS = 2_000;

    private final InspectionConfig config;
    private final long actionDelayMs;

    PageInspector(InspectionConfig config, long actionDelayMs) {
        this.config = config;
        this.actionDelayMs = actionDelayMs;
    }

    boolean hasConsentBanner(Page page) {
        for (String selector : config.getBannerSelectors()) {
            try {
                if (page.locator(selector).first().isVisible()) {
                    log.debug("Consent banner matched '{}' on {}", selector, page.url());
                    return true;
                }
            } catch (PlaywrightException e) {
                log.debug("Banner selector '{}' failed on {}: {}", selector, page.url(), e.getMessage());
            }
        }
        return false;
    }

    boolean hasOptOutLink(Page page) {
        List<String> texts = linkTexts(page);
        for (String text : texts) {
            for (String pattern : config.getOptOutLinkTexts()) {
                if (text.contains(pattern.toLowerCase(Locale.ROOT))) {
                    log.debug("Opt-out link '{}' found on {}", text, page.url());
                    return true;
                }
            }
        }
        return false;
    }

    ConsentAction rejectConsent(Page page) {
        for (String text : config.getRejectButtonTexts()) {
            Locator button = page.getByRole(AriaRole.BUTTON, new Page.GetByRoleOptions()
                    .setName(Pattern.compile(Pattern.quote(text), Pattern.CASE_INSENSITIVE)));
            if (tryClick(page, button, "text '" + text + "'")) {
                return ConsentAction.REJECTED;
            }
        }
        for (String selector : config.getRejectSelectors()) {
            if (tryClick(page, page.locator(selector), "selector '" + selector + "'")) {
                return ConsentAction.REJECTED;
            }
        }
        log.debug("No consent reject control found on {}", page.url());
        return ConsentAction.NOT_FOUND;
    }

    private boolean tryClick(Page page, Locator candidates, String description) {
        try {
            Locator target = candidates.first();
            if (candidates.count() == 0 || !target.isVisible()) {
                return false;
            }
            target.click(new Locator.ClickOptions().setTimeout(CLICK_TIMEOUT_MS));
            page.waitForTimeout(actionDelayMs);
            log.debug("Clicked consent reject control ({}) on {}", description, page.url());
            return true;
        } catch (PlaywrightException e) {
            log.debug("Consent reject control ({}) not clickable on {}: {}", description, page.url(), e.getMessage());
            return false;
        }
    }

    private List<String> linkTexts(Page page) {
        try {
            Object result = page.evaluate(LINK_TEXTS_SCRIPT);
            if (result instanceof List<?> values) {
                return values.stream().map(String::valueOf).toList();
            }
        } catch (PlaywrightException e) {
            log.debug("Could not read link texts on {}: {}", page.url(), e.getMessage());
        }
        return List.of();
    }
}
