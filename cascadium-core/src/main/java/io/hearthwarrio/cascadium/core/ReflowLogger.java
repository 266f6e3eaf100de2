package io.hearthwarrio.cascadium.core;

import io.hearthwarrio.cascadium.core.css.StylesheetParseException;
import io.hearthwarrio.cascadium.core.layout.LayoutTree;

/**
 * Receives diagnostics from {@link ReflowEngine}.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 * <p>
 * Note: {@link #detail()} is used by the engine to decide whether it should render a layout tree dump at all.
 */
@FunctionalInterface
public interface ReflowLogger {

    /**
     * Called once per reflow, after the layout tree has been published.
     *
     * @param tree  the new layout tree
     * @param stats counters and timings
     * @param dump  indented layout tree dump; {@code null} unless {@link #detail()} is {@link ReflowLogDetail#TREE}
     */
    void reflowCompleted(LayoutTree tree, ReflowStats stats, String dump);

    /**
     * Called for every non-fatal warning of a reflow.
     */
    default void warning(UnresolvedReferenceWarning warning) {
    }

    /**
     * Called when a stylesheet is malformed. The reflow continues with the rules recovered before the error.
     *
     * @param stylesheetIndex position of the stylesheet in the reflow's list
     * @param error           parse failure
     */
    default void parseError(int stylesheetIndex, StylesheetParseException error) {
    }

    default ReflowLogDetail detail() {
        return ReflowLogDetail.SUMMARY;
    }
}
