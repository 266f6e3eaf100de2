package io.hearthwarrio.cascadium.core.css;

import io.hearthwarrio.cascadium.core.WarningSink;

import java.util.List;

/**
 * Turns a parsed declaration into the declarations that enter a rule: expands shorthands into longhands
 * and drops declarations for unknown properties, reporting them to the sink.
 */
@FunctionalInterface
public interface DeclarationProcessor {

    /**
     * Keeps every declaration as written.
     */
    DeclarationProcessor ACCEPT_ALL = (declaration, warnings) -> List.of(declaration);

    List<Declaration> process(Declaration declaration, WarningSink warnings);
}
