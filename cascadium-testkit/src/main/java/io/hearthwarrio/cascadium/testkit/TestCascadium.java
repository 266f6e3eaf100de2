package io.hearthwarrio.cascadium.testkit;

import io.hearthwarrio.cascadium.core.ReflowEngine;
import io.hearthwarrio.cascadium.core.ReflowLogDetail;
import io.hearthwarrio.cascadium.webdriver.CascadiumWebDriver;
import org.openqa.selenium.WebDriver;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Convenience factory methods for creating Cascadium instances in tests.
 * <p>
 * Does not depend on Allure.
 */
public final class TestCascadium {

    private TestCascadium() {
        // utility class
    }

    /**
     * Creates a CascadiumWebDriver without logging.
     */
    public static CascadiumWebDriver plain(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new CascadiumWebDriver(driver);
    }

    /**
     * Creates a CascadiumWebDriver with stdout reflow logging enabled.
     */
    public static CascadiumWebDriver stdout(WebDriver driver, ReflowLogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new CascadiumWebDriver(driver, new ReflowEngine())
                .withLoggingToStdOut(detail);
    }

    /**
     * Encodes a page as a {@code data:} URL so tests need no files or web server.
     */
    public static String dataUrl(String html) {
        Objects.requireNonNull(html, "html must not be null");
        return "data:text/html;charset=utf-8;base64," +
                Base64.getEncoder().encodeToString(html.getBytes(StandardCharsets.UTF_8));
    }
}
