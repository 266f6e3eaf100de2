package io.hearthwarrio.cascadium.core;

/**
 * Controls how much a {@link ReflowLogger} is told about a finished reflow.
 */
public enum ReflowLogDetail {

    /**
     * Only counts; no statistics beyond element and warning totals.
     */
    NONE,

    /**
     * Counts and timings.
     */
    SUMMARY,

    /**
     * Counts, timings and a full layout tree dump.
     */
    TREE
}
