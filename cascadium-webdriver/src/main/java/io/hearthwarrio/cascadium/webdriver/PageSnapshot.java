package io.hearthwarrio.cascadium.webdriver;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.layout.Rect;

import java.util.List;
import java.util.Objects;

/**
 * Element tree, embedded stylesheets and browser-computed border boxes captured from a live page.
 * <p>
 * {@link #getBrowserBoxes()} is parallel to {@link Document#getElements()}: index {@code i} holds the rectangle the
 * browser reported for element {@code i}.
 */
public final class PageSnapshot {

    private final Document document;
    private final List<String> stylesheets;
    private final List<Rect> browserBoxes;
    private final double viewportWidth;
    private final double viewportHeight;

    public PageSnapshot(
            Document document,
            List<String> stylesheets,
            List<Rect> browserBoxes,
            double viewportWidth,
            double viewportHeight
    ) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.stylesheets = List.copyOf(Objects.requireNonNull(stylesheets, "stylesheets must not be null"));
        this.browserBoxes = List.copyOf(Objects.requireNonNull(browserBoxes, "browserBoxes must not be null"));
        if (this.browserBoxes.size() != document.size()) {
            throw new IllegalArgumentException("Expected " + document.size() + " browser boxes, got " + this.browserBoxes.size());
        }
        this.viewportWidth = viewportWidth;
        this.viewportHeight = viewportHeight;
    }

    public Document getDocument() {
        return document;
    }

    public List<String> getStylesheets() {
        return stylesheets;
    }

    public List<Rect> getBrowserBoxes() {
        return browserBoxes;
    }

    public Rect getBrowserBox(int elementIndex) {
        return browserBoxes.get(elementIndex);
    }

    public double getViewportWidth() {
        return viewportWidth;
    }

    public double getViewportHeight() {
        return viewportHeight;
    }

    @Override
    public String toString() {
        return "PageSnapshot{" +
                "elements=" + document.size() +
                ", stylesheets=" + stylesheets.size() +
                ", viewport=" + viewportWidth + "x" + viewportHeight +
                '}';
    }
}
