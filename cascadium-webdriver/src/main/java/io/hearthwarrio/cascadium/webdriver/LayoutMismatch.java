package io.hearthwarrio.cascadium.webdriver;

import io.hearthwarrio.cascadium.core.dom.Element;
import io.hearthwarrio.cascadium.core.layout.Rect;

import java.util.Objects;

/**
 * One element whose computed border box differs from the browser's.
 */
public final class LayoutMismatch {

    private final Element element;
    private final Rect computed;
    private final Rect browser;

    public LayoutMismatch(Element element, Rect computed, Rect browser) {
        this.element = Objects.requireNonNull(element, "element must not be null");
        this.computed = Objects.requireNonNull(computed, "computed must not be null");
        this.browser = Objects.requireNonNull(browser, "browser must not be null");
    }

    public Element getElement() {
        return element;
    }

    public Rect getComputed() {
        return computed;
    }

    public Rect getBrowser() {
        return browser;
    }

    /**
     * Largest absolute difference over x, y, width and height.
     */
    public double getMaxDelta() {
        return LayoutComparison.maxDelta(computed, browser);
    }

    @Override
    public String toString() {
        return element.describe() + " computed=" + computed + " browser=" + browser;
    }
}
