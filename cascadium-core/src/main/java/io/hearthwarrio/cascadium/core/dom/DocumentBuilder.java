package io.hearthwarrio.cascadium.core.dom;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming builder used by markup parsers to create a {@link Document}.
 * <p>
 * Calls mirror a SAX-style event stream: {@link #open(String)} starts a child of the current element,
 * {@link #close()} returns to its parent. Attribute and text calls apply to the current element.
 * <pre>
 * Document doc = Document.builder("html")
 *         .open("body")
 *             .open("div").id("main").classes("card", "wide")
 *                 .open("p").text("Hello").close()
 *             .close()
 *         .close()
 *         .build();
 * </pre>
 * This class is not thread-safe.
 */
public final class DocumentBuilder {

    static final class NodeSpec {
        final String tagName;
        final int parent;
        final int siblingPosition;
        final Map<String, String> attributes = new LinkedHashMap<>();
        final StringBuilder text = new StringBuilder();
        final List<Integer> children = new ArrayList<>();

        NodeSpec(String tagName, int parent, int siblingPosition) {
            this.tagName = tagName;
            this.parent = parent;
            this.siblingPosition = siblingPosition;
        }
    }

    private final List<NodeSpec> specs = new ArrayList<>();
    private final Deque<Integer> open = new ArrayDeque<>();
    private boolean built;

    DocumentBuilder(String rootTag) {
        specs.add(new NodeSpec(normalizeTag(rootTag), -1, 0));
        open.push(0);
    }

    /**
     * Opens a child element of the current element and makes it current.
     */
    public DocumentBuilder open(String tagName) {
        ensureNotBuilt();
        int parent = current();
        NodeSpec parentSpec = specs.get(parent);
        int index = specs.size();
        specs.add(new NodeSpec(normalizeTag(tagName), parent, parentSpec.children.size()));
        parentSpec.children.add(index);
        open.push(index);
        return this;
    }

    /**
     * Closes the current element. Closing the root is not allowed.
     */
    public DocumentBuilder close() {
        ensureNotBuilt();
        if (open.size() <= 1) {
            throw new IllegalStateException("Cannot close the root element");
        }
        open.pop();
        return this;
    }

    /**
     * Sets an attribute on the current element. A {@code null} value removes the attribute.
     */
    public DocumentBuilder attribute(String name, String value) {
        ensureNotBuilt();
        Objects.requireNonNull(name, "name must not be null");
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return this;
        }
        Map<String, String> attrs = specs.get(current()).attributes;
        if (value == null) {
            attrs.remove(key);
        } else {
            attrs.put(key, value);
        }
        return this;
    }

    public DocumentBuilder id(String id) {
        return attribute("id", id);
    }

    /**
     * Replaces the class list of the current element.
     */
    public DocumentBuilder classes(String... classNames) {
        Objects.requireNonNull(classNames, "classNames must not be null");
        return attribute("class", String.join(" ", classNames));
    }

    /**
     * Sets the inline {@code style} attribute of the current element.
     */
    public DocumentBuilder style(String inlineStyle) {
        return attribute("style", inlineStyle);
    }

    /**
     * Appends text owned by the current element. Whitespace runs are collapsed to a single space.
     */
    public DocumentBuilder text(String text) {
        ensureNotBuilt();
        if (text == null || text.isEmpty()) {
            return this;
        }
        StringBuilder sb = specs.get(current()).text;
        String collapsed = text.replaceAll("\\s+", " ");
        if (sb.length() == 0) {
            collapsed = collapsed.stripLeading();
        } else if (sb.charAt(sb.length() - 1) == ' ' && collapsed.startsWith(" ")) {
            collapsed = collapsed.substring(1);
        }
        sb.append(collapsed);
        return this;
    }

    /**
     * Tag name of the current element.
     */
    public String currentTag() {
        return specs.get(current()).tagName;
    }

    /**
     * Nesting depth of the current element (the root is 0).
     */
    public int depth() {
        return open.size() - 1;
    }

    /**
     * Finishes the document. Elements still open are closed implicitly.
     */
    public Document build() {
        ensureNotBuilt();
        built = true;
        for (NodeSpec spec : specs) {
            int len = spec.text.length();
            if (len > 0 && spec.text.charAt(len - 1) == ' ') {
                spec.text.setLength(len - 1);
            }
        }
        return new Document(specs);
    }

    private int current() {
        Integer top = open.peek();
        if (top == null) {
            throw new IllegalStateException("No open element");
        }
        return top;
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("Document already built");
        }
    }

    private static String normalizeTag(String tagName) {
        Objects.requireNonNull(tagName, "tagName must not be null");
        String t = tagName.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty()) {
            throw new IllegalArgumentException("tagName must not be blank");
        }
        return t;
    }
}
