package io.hearthwarrio.cascadium.core;

import io.hearthwarrio.cascadium.core.css.StylesheetParseException;
import io.hearthwarrio.cascadium.core.layout.LayoutTree;

import java.util.ArrayList;
import java.util.List;

final class RecordingReflowLogger implements ReflowLogger {

    final List<UnresolvedReferenceWarning> warnings = new ArrayList<>();
    final List<StylesheetParseException> parseErrors = new ArrayList<>();
    final List<ReflowStats> stats = new ArrayList<>();
    final List<String> dumps = new ArrayList<>();
    private final ReflowLogDetail detail;

    RecordingReflowLogger(ReflowLogDetail detail) {
        this.detail = detail;
    }

    @Override
    public ReflowLogDetail detail() {
        return detail;
    }

    @Override
    public void warning(UnresolvedReferenceWarning warning) {
        warnings.add(warning);
    }

    @Override
    public void parseError(int stylesheetIndex, StylesheetParseException error) {
        parseErrors.add(error);
    }

    @Override
    public void reflowCompleted(LayoutTree tree, ReflowStats stats, String dump) {
        this.stats.add(stats);
        dumps.add(dump);
    }
}
