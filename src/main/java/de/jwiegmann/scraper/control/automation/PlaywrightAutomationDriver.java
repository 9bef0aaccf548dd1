package de.jwiegmann.scraper.control.automation;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import de.jwiegmann.scraper.control.exception.AutomationTimeoutException;
import de.jwiegmann.scraper.control.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Playwright-Anbindung über CDP. Verwendet den ersten Browser-Kontext der Session
 * und darin die erste vorhandene Seite bzw. eine neue.
 */
@Slf4j
@Component
public class PlaywrightAutomationDriver implements AutomationDriver {

    @Override
    public AutomationConnection connect(String endpoint, Duration timeout) {
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().connectOverCDP(endpoint,
                    new BrowserType.ConnectOverCDPOptions().setTimeout(timeout.toMillis()));
            log.info("Connected to remote browser session via CDP");
            Page page = selectPage(browser);
            page.setDefaultTimeout(timeout.toMillis());
            return new PlaywrightConnection(playwright, browser, page, timeout);
        } catch (TimeoutError e) {
            playwright.close();
            throw new AutomationTimeoutException("CDP connect", timeout, e);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new ProviderException("CDP connect failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    private static Page selectPage(Browser browser) {
        List<BrowserContext> contexts = browser.contexts();
        if (contexts.isEmpty()) {
            throw new IllegalStateException("No browser contexts found in the connected session");
        }
        BrowserContext context = contexts.get(0);
        if (context.pages().isEmpty()) {
            log.warn("No pages found in context, creating a new one");
            return context.newPage();
        }
        return context.pages().get(0);
    }

    static final class PlaywrightConnection implements AutomationConnection {

        private final Playwright playwright;
        private final Browser browser;
        private final Page page;
        // Limit für Operationen ohne eigenes Timeout (Titel, Inhalt)
        private final Duration operationTimeout;

        PlaywrightConnection(Playwright playwright, Browser browser, Page page, Duration operationTimeout) {
            this.playwright = playwright;
            this.browser = browser;
            this.page = page;
            this.operationTimeout = operationTimeout;
        }

        @Override
        public void navigate(String url, Duration timeout) {
            try {
                page.navigate(url, new Page.NavigateOptions()
                        .setTimeout(timeout.toMillis())
                        .setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
            } catch (TimeoutError e) {
                throw new AutomationTimeoutException("Navigation to " + url, timeout, e);
            } catch (PlaywrightException e) {
                throw new ProviderException("Navigation to " + url + " failed: " + e.getMessage(), e);
            }
        }

        @Override
        public String title() {
            try {
                return page.title();
            } catch (TimeoutError e) {
                throw new AutomationTimeoutException("Reading page title", operationTimeout, e);
            } catch (PlaywrightException e) {
                throw new ProviderException("Reading page title failed: " + e.getMessage(), e);
            }
        }

        @Override
        public long contentLength() {
            try {
                return page.content().length();
            } catch (TimeoutError e) {
                throw new AutomationTimeoutException("Reading page content", operationTimeout, e);
            } catch (PlaywrightException e) {
                throw new ProviderException("Reading page content failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                if (browser.isConnected()) {
                    log.info("Closing browser connection");
                    browser.close();
                }
            } finally {
                playwright.close();
            }
        }
    }
}
