package io.hearthwarrio.cascadium.webdriver;

import java.util.List;

/**
 * Thrown by {@link CascadiumWebDriver#assertMatchesBrowser()} when computed and browser layouts disagree.
 */
public class LayoutMismatchException extends RuntimeException {

    private final List<LayoutMismatch> mismatches;

    public LayoutMismatchException(List<LayoutMismatch> mismatches) {
        super(buildMessage(mismatches));
        this.mismatches = List.copyOf(mismatches);
    }

    public List<LayoutMismatch> getMismatches() {
        return mismatches;
    }

    private static String buildMessage(List<LayoutMismatch> mismatches) {
        StringBuilder sb = new StringBuilder();
        sb.append(mismatches.size()).append(" element(s) differ from the browser layout:");
        for (LayoutMismatch m : mismatches) {
            sb.append("\n  ").append(m);
        }
        return sb.toString();
    }
}
