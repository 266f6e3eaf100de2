package io.hearthwarrio.cascadium.webdriver;

import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.DocumentBuilder;
import io.hearthwarrio.cascadium.core.layout.Rect;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the live DOM of a Selenium session to a Cascadium {@link Document}.
 * <p>
 * The page is read with a single script call: a pre-order walk of the element tree that returns, per element, its
 * tag, nesting depth, attributes, own text and bounding client rectangle. One round trip keeps the element tree and
 * the rectangles consistent with each other.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class WebDriverDomMapper {

    static final String SNAPSHOT_SCRIPT =
            "var out = [];" +
            "var sx = window.scrollX || 0, sy = window.scrollY || 0;" +
            "function walk(el, depth) {" +
            "  var attrs = {};" +
            "  for (var i = 0; i < el.attributes.length; i++) {" +
            "    attrs[el.attributes[i].name] = el.attributes[i].value;" +
            "  }" +
            "  var tag = el.tagName.toLowerCase();" +
            "  var text = '';" +
            "  if (tag !== 'style' && tag !== 'script') {" +
            "    for (var n = el.firstChild; n; n = n.nextSibling) {" +
            "      if (n.nodeType === 3) { text += n.nodeValue; }" +
            "    }" +
            "  }" +
            "  var r = el.getBoundingClientRect();" +
            "  out.push({tag: tag, depth: depth, attrs: attrs, text: text," +
            "            rect: [r.left + sx, r.top + sy, r.width, r.height]});" +
            "  for (var c = el.firstElementChild; c; c = c.nextElementSibling) { walk(c, depth + 1); }" +
            "}" +
            "walk(document.documentElement, 0);" +
            "var sheets = [];" +
            "var styles = document.querySelectorAll('style');" +
            "for (var s = 0; s < styles.length; s++) { sheets.push(styles[s].textContent); }" +
            "return {elements: out, stylesheets: sheets," +
            "        viewport: [document.documentElement.clientWidth, window.innerHeight]};";

    private final WebDriver driver;
    private final JavascriptExecutor js;

    /**
     * @param driver Selenium WebDriver instance; must implement {@link JavascriptExecutor}
     */
    public WebDriverDomMapper(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalArgumentException("driver must implement JavascriptExecutor");
        }
        this.js = (JavascriptExecutor) driver;
    }

    public WebDriver getDriver() {
        return driver;
    }

    /**
     * Captures the current page.
     *
     * @return element tree, stylesheets and browser rectangles
     * @throws DomSnapshotException when the script fails or returns an unexpected shape
     */
    public PageSnapshot snapshot() {
        Object raw;
        try {
            raw = js.executeScript(SNAPSHOT_SCRIPT);
        } catch (RuntimeException e) {
            throw new DomSnapshotException("Cannot read DOM snapshot: " + e.getMessage(), e);
        }
        return fromScriptResult(raw);
    }

    /**
     * Converts the raw value returned by {@link #SNAPSHOT_SCRIPT}.
     * <p>
     * Selenium hands JavaScript objects back as maps, arrays as lists and numbers as {@link Long} or {@link Double}.
     */
    static PageSnapshot fromScriptResult(Object raw) {
        Map<?, ?> result = asMap(raw, "snapshot");
        List<?> elements = asList(result.get("elements"), "elements");
        if (elements.isEmpty()) {
            throw new DomSnapshotException("Snapshot contains no elements", null);
        }

        DocumentBuilder builder = null;
        List<Rect> boxes = new ArrayList<>(elements.size());
        for (Object e : elements) {
            Map<?, ?> node = asMap(e, "element");
            String tag = asString(node.get("tag"));
            int depth = (int) asNumber(node.get("depth"), "depth");

            if (builder == null) {
                if (depth != 0) {
                    throw new DomSnapshotException("First element must be the root, got depth " + depth, null);
                }
                builder = Document.builder(tag);
            } else {
                if (depth < 1 || depth > builder.depth() + 1) {
                    throw new DomSnapshotException("Unexpected depth " + depth + " after depth " + builder.depth(), null);
                }
                while (builder.depth() >= depth) {
                    builder.close();
                }
                builder.open(tag);
            }

            Object attrs = node.get("attrs");
            if (attrs != null) {
                for (Map.Entry<?, ?> a : asMap(attrs, "attrs").entrySet()) {
                    builder.attribute(String.valueOf(a.getKey()), asString(a.getValue()));
                }
            }
            builder.text(asString(node.get("text")));
            boxes.add(toRect(node.get("rect")));
        }

        List<?> sheets = result.get("stylesheets") == null
                ? Collections.emptyList()
                : asList(result.get("stylesheets"), "stylesheets");
        List<String> stylesheets = new ArrayList<>(sheets.size());
        for (Object s : sheets) {
            stylesheets.add(asString(s));
        }

        List<?> viewport = asList(result.get("viewport"), "viewport");
        if (viewport.size() != 2) {
            throw new DomSnapshotException("viewport must have 2 components", null);
        }

        return new PageSnapshot(
                builder.build(),
                stylesheets,
                boxes,
                asNumber(viewport.get(0), "viewport width"),
                asNumber(viewport.get(1), "viewport height")
        );
    }

    private static Rect toRect(Object raw) {
        List<?> r = asList(raw, "rect");
        if (r.size() != 4) {
            throw new DomSnapshotException("rect must have 4 components, got " + r.size(), null);
        }
        return new Rect(
                asNumber(r.get(0), "rect x"),
                asNumber(r.get(1), "rect y"),
                asNumber(r.get(2), "rect width"),
                asNumber(r.get(3), "rect height")
        );
    }

    private static Map<?, ?> asMap(Object v, String what) {
        if (!(v instanceof Map)) {
            throw new DomSnapshotException(what + " must be an object, got " + v, null);
        }
        return (Map<?, ?>) v;
    }

    private static List<?> asList(Object v, String what) {
        if (!(v instanceof List)) {
            throw new DomSnapshotException(what + " must be an array, got " + v, null);
        }
        return (List<?>) v;
    }

    private static double asNumber(Object v, String what) {
        if (!(v instanceof Number)) {
            throw new DomSnapshotException(what + " must be a number, got " + v, null);
        }
        return ((Number) v).doubleValue();
    }

    private static String asString(Object v) {
        return v == null ? "" : String.valueOf(v);
    }
}
