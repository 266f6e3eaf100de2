package io.hearthwarrio.cascadium.html;

import io.hearthwarrio.cascadium.core.dom.Document;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing an HTML page: the element tree and the text of its {@code <style>} elements in document order.
 */
public final class HtmlPage {

    private final Document document;
    private final List<String> stylesheets;

    public HtmlPage(Document document, List<String> stylesheets) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.stylesheets = List.copyOf(Objects.requireNonNull(stylesheets, "stylesheets must not be null"));
    }

    public Document getDocument() {
        return document;
    }

    public List<String> getStylesheets() {
        return stylesheets;
    }

    @Override
    public String toString() {
        return "HtmlPage{" +
                "elements=" + document.size() +
                ", stylesheets=" + stylesheets.size() +
                '}';
    }
}
