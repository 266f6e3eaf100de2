package io.hearthwarrio.cascadium.testkit;

import org.openqa.selenium.Capabilities;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.URL;
import java.time.Duration;
import java.util.Objects;

/**
 * Browser sessions for comparing Cascadium boxes against a real rendering.
 * <p>
 * The engine is handed the viewport width the page snapshot reports, and percentage widths,
 * auto margins and line wrapping all follow from it. Every session therefore starts at
 * {@link #DEFAULT_WINDOW_SIZE}, so a failing comparison reproduces on any machine instead of
 * depending on the size of the window the driver happened to open. Headless Chrome also runs
 * without scrollbars and at device scale factor 1: a scrollbar would take width away from the
 * layout viewport, and scaling would make CSS pixels differ from the engine's {@code px}.
 */
public final class TestDrivers {

    public static final Duration DEFAULT_IMPLICIT_WAIT = Duration.ofSeconds(2);

    public static final Dimension DEFAULT_WINDOW_SIZE = new Dimension(1024, 768);

    private TestDrivers() {
        // utility class
    }

    /**
     * Creates a headless local ChromeDriver.
     */
    public static WebDriver headlessChrome() {
        ChromeOptions options = new ChromeOptions();
        options.addArguments("--headless=new", "--hide-scrollbars", "--force-device-scale-factor=1");
        return chrome(options);
    }

    /**
     * Creates a local ChromeDriver with provided options.
     */
    public static WebDriver chrome(ChromeOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        WebDriver driver = new ChromeDriver(options);
        applyDefaults(driver);
        return driver;
    }

    /**
     * Creates a RemoteWebDriver with provided Selenium Grid URL and capabilities.
     */
    public static WebDriver remote(URL remoteUrl, Capabilities capabilities) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");

        WebDriver driver = new RemoteWebDriver(remoteUrl, capabilities);
        applyDefaults(driver);
        return driver;
    }

    private static void applyDefaults(WebDriver driver) {
        driver.manage().timeouts().implicitlyWait(DEFAULT_IMPLICIT_WAIT);
        driver.manage().window().setSize(DEFAULT_WINDOW_SIZE);
    }
}
