package io.hearthwarrio.cascadium.core;

import io.hearthwarrio.cascadium.core.css.StylesheetParseException;
import io.hearthwarrio.cascadium.core.layout.LayoutTree;

import java.util.Objects;

/**
 * Default stdout logger for reflows.
 */
public final class StdOutReflowLogger implements ReflowLogger {

    private final ReflowLogDetail detail;

    public StdOutReflowLogger(ReflowLogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public ReflowLogDetail detail() {
        return detail;
    }

    @Override
    public void warning(UnresolvedReferenceWarning warning) {
        System.out.println("[Cascadium] warning " + warning);
    }

    @Override
    public void parseError(int stylesheetIndex, StylesheetParseException error) {
        System.out.println("[Cascadium] stylesheet #" + stylesheetIndex + " malformed: " + error.getMessage() +
                " (" + error.getRecoveredRules().size() + " rules recovered)");
    }

    @Override
    public void reflowCompleted(LayoutTree tree, ReflowStats stats, String dump) {
        if (detail == ReflowLogDetail.NONE) {
            // still log something minimal
            System.out.println("[Cascadium] reflow elements=" + stats.getElementCount() +
                    ", warnings=" + stats.getWarningCount());
            return;
        }

        StringBuilder sb = new StringBuilder(256);
        sb.append("[Cascadium] reflow ").append(stats)
                .append(", viewport=").append(tree.getViewportWidth()).append('x').append(tree.getViewportHeight());
        if (dump != null) {
            sb.append('\n').append(dump);
        }
        System.out.println(sb);
    }
}
