package io.hearthwarrio.cascadium.core;

/**
 * Counters and timings of one reflow.
 */
public final class ReflowStats {

    private final int elementCount;
    private final int stylesheetCount;
    private final int ruleCount;
    private final int warningCount;
    private final int parseErrorCount;
    private final long cascadeNanos;
    private final long layoutNanos;

    public ReflowStats(
            int elementCount,
            int stylesheetCount,
            int ruleCount,
            int warningCount,
            int parseErrorCount,
            long cascadeNanos,
            long layoutNanos
    ) {
        this.elementCount = elementCount;
        this.stylesheetCount = stylesheetCount;
        this.ruleCount = ruleCount;
        this.warningCount = warningCount;
        this.parseErrorCount = parseErrorCount;
        this.cascadeNanos = cascadeNanos;
        this.layoutNanos = layoutNanos;
    }

    public int getElementCount() {
        return elementCount;
    }

    /**
     * Stylesheets applied, including the user-agent stylesheet when enabled.
     */
    public int getStylesheetCount() {
        return stylesheetCount;
    }

    public int getRuleCount() {
        return ruleCount;
    }

    public int getWarningCount() {
        return warningCount;
    }

    public int getParseErrorCount() {
        return parseErrorCount;
    }

    public long getCascadeNanos() {
        return cascadeNanos;
    }

    public long getLayoutNanos() {
        return layoutNanos;
    }

    @Override
    public String toString() {
        return "elements=" + elementCount +
                ", stylesheets=" + stylesheetCount +
                ", rules=" + ruleCount +
                ", warnings=" + warningCount +
                ", parseErrors=" + parseErrorCount +
                ", cascade=" + millis(cascadeNanos) + "ms" +
                ", layout=" + millis(layoutNanos) + "ms";
    }

    private static String millis(long nanos) {
        return String.valueOf(Math.round(nanos / 10_000.0) / 100.0);
    }
}
