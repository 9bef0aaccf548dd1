package de.jwiegmann.scraper.control.automation;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import de.jwiegmann.scraper.control.exception.AutomationTimeoutException;
import de.jwiegmann.scraper.control.exception.ProviderException;
import de.jwiegmann.scraper.control.executor.FailureCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlaywrightAutomationDriverTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    @Mock
    private Playwright playwright;

    @Mock
    private Browser browser;

    @Mock
    private Page page;

    private PlaywrightAutomationDriver.PlaywrightConnection connection;

    @BeforeEach
    void setUp() {
        connection = new PlaywrightAutomationDriver.PlaywrightConnection(playwright, browser, page, TIMEOUT);
    }

    @Test
    void extraction_returnsTitleAndContentLength() {
        when(page.title()).thenReturn("Example Domain");
        when(page.content()).thenReturn("<html></html>");

        assertThat(connection.title()).isEqualTo("Example Domain");
        assertThat(connection.contentLength()).isEqualTo(13L);
    }

    @Test
    void closedBrowserDuringExtraction_isProviderError() {
        when(page.title()).thenThrow(new PlaywrightException("Target page, context or browser has been closed"));
        when(page.content()).thenThrow(new PlaywrightException("Target page, context or browser has been closed"));

        assertThatThrownBy(() -> connection.title())
                .isInstanceOf(ProviderException.class)
                .satisfies(e -> assertThat(FailureCategory.of(e)).isEqualTo(FailureCategory.PROVIDER))
                .hasMessageContaining("has been closed");
        assertThatThrownBy(() -> connection.contentLength()).isInstanceOf(ProviderException.class);
    }

    @Test
    void timeoutsDuringExtractionAndNavigation_areTimeouts() {
        when(page.content()).thenThrow(new TimeoutError("Timeout 60000ms exceeded."));
        when(page.navigate(eq("https://example.com/"), any(Page.NavigateOptions.class)))
                .thenThrow(new TimeoutError("Timeout 60000ms exceeded."));

        assertThatThrownBy(() -> connection.contentLength())
                .isInstanceOf(AutomationTimeoutException.class)
                .hasMessageContaining("60000 ms");
        assertThatThrownBy(() -> connection.navigate("https://example.com/", TIMEOUT))
                .isInstanceOf(AutomationTimeoutException.class)
                .satisfies(e -> assertThat(FailureCategory.of(e)).isEqualTo(FailureCategory.TIMEOUT));
    }

    @Test
    void close_closesBrowserAndPlaywright() {
        when(browser.isConnected()).thenReturn(true);

        connection.close();

        verify(browser).close();
        verify(playwright).close();
    }
}
