package io.hearthwarrio.cascadium.webdriver;

import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;

import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds values shaped like the snapshot script's result, as Selenium returns them.
 */
final class SnapshotFixtures {

    private final List<Object> elements = new ArrayList<>();
    private final List<Object> stylesheets = new ArrayList<>();
    private List<Object> viewport = Arrays.asList(800L, 600L);

    SnapshotFixtures element(String tag, long depth, Map<String, Object> attrs, String text, Number... rect) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("tag", tag);
        node.put("depth", depth);
        node.put("attrs", attrs);
        node.put("text", text);
        node.put("rect", Arrays.asList((Object[]) rect));
        elements.add(node);
        return this;
    }

    SnapshotFixtures stylesheet(String css) {
        stylesheets.add(css);
        return this;
    }

    SnapshotFixtures viewport(Number width, Number height) {
        viewport = Arrays.asList(width, height);
        return this;
    }

    Map<String, Object> build() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("elements", elements);
        out.put("stylesheets", stylesheets);
        out.put("viewport", viewport);
        return out;
    }

    /**
     * WebDriver whose {@code executeScript} always answers with the given value.
     */
    static WebDriver scriptedDriver(Object scriptResult) {
        return (WebDriver) Proxy.newProxyInstance(
                SnapshotFixtures.class.getClassLoader(),
                new Class<?>[]{WebDriver.class, JavascriptExecutor.class},
                (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "executeScript":
                            return scriptResult;
                        case "hashCode":
                            return System.identityHashCode(proxy);
                        case "equals":
                            return proxy == args[0];
                        case "toString":
                            return "ScriptedDriver";
                        default:
                            throw new UnsupportedOperationException(method.getName());
                    }
                }
        );
    }

    static Map<String, Object> attrs(String... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            out.put(keyValues[i], keyValues[i + 1]);
        }
        return out;
    }
}
