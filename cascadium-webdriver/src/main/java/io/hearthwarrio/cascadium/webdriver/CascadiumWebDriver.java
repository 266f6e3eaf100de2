package io.hearthwarrio.cascadium.webdriver;

import io.hearthwarrio.cascadium.core.ReflowEngine;
import io.hearthwarrio.cascadium.core.ReflowLogDetail;
import io.hearthwarrio.cascadium.core.ReflowLogger;
import io.hearthwarrio.cascadium.core.layout.LayoutTree;
import org.openqa.selenium.WebDriver;

import java.util.List;
import java.util.Objects;

/**
 * Selenium entry point: lays out the page currently open in a browser and checks the result against the browser.
 * <p>
 * Every call takes a fresh snapshot, so DOM mutations between calls are picked up.
 */
public class CascadiumWebDriver {

    private final WebDriverDomMapper domMapper;
    private final ReflowEngine engine;
    private double tolerance = LayoutComparison.DEFAULT_TOLERANCE;

    public CascadiumWebDriver(WebDriver driver) {
        this(driver, new ReflowEngine());
    }

    public CascadiumWebDriver(WebDriver driver, ReflowEngine engine) {
        this.domMapper = new WebDriverDomMapper(driver);
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public CascadiumWebDriver withLogger(ReflowLogger logger) {
        engine.withLogger(logger);
        return this;
    }

    public CascadiumWebDriver withLoggingToStdOut(ReflowLogDetail detail) {
        engine.withLoggingToStdOut(detail);
        return this;
    }

    /**
     * Allowed difference per coordinate, px, for {@link #compareWithBrowser()}.
     */
    public CascadiumWebDriver withTolerance(double tolerance) {
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("tolerance must be >= 0, got " + tolerance);
        }
        this.tolerance = tolerance;
        return this;
    }

    public ReflowEngine getEngine() {
        return engine;
    }

    public WebDriver getDriver() {
        return domMapper.getDriver();
    }

    public PageSnapshot snapshot() {
        return domMapper.snapshot();
    }

    /**
     * Lays out the current page with its embedded stylesheets at the browser's viewport size.
     */
    public LayoutTree reflow() {
        return reflow(snapshot());
    }

    public LayoutTree reflow(PageSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        return engine.reflow(
                snapshot.getDocument(),
                snapshot.getStylesheets(),
                snapshot.getViewportWidth(),
                snapshot.getViewportHeight()
        );
    }

    public List<LayoutMismatch> compareWithBrowser() {
        PageSnapshot snapshot = snapshot();
        return LayoutComparison.compare(reflow(snapshot), snapshot, tolerance);
    }

    /**
     * @throws LayoutMismatchException when at least one rendered element differs beyond the tolerance
     */
    public void assertMatchesBrowser() {
        List<LayoutMismatch> mismatches = compareWithBrowser();
        if (!mismatches.isEmpty()) {
            throw new LayoutMismatchException(mismatches);
        }
    }
}
