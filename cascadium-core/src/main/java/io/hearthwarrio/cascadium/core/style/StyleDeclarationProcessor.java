package io.hearthwarrio.cascadium.core.style;

import io.hearthwarrio.cascadium.core.UnresolvedReferenceWarning;
import io.hearthwarrio.cascadium.core.WarningSink;
import io.hearthwarrio.cascadium.core.css.Declaration;
import io.hearthwarrio.cascadium.core.css.DeclarationProcessor;

import java.util.List;
import java.util.Objects;

/**
 * Validates declarations while a stylesheet is parsed: shorthands are expanded, values are checked against
 * their property's type, and unknown properties are dropped unless registered as extensions.
 */
public final class StyleDeclarationProcessor implements DeclarationProcessor {

    private final PropertyRegistry registry;

    public StyleDeclarationProcessor(PropertyRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public List<Declaration> process(Declaration declaration, WarningSink warnings) {
        String name = declaration.getProperty();
        String value = declaration.getValue();

        if (Shorthands.isShorthand(name)) {
            List<Declaration> expanded = Shorthands.expand(declaration);
            if (expanded == null) {
                warnings.warn(UnresolvedReferenceWarning.Kind.INVALID_VALUE, name,
                        "Invalid value '" + value + "'");
                return List.of();
            }
            return expanded;
        }

        Property property = Property.byName(name);
        if (property != null) {
            if (Shorthands.isCssWideKeyword(value) || ValueCoercer.isValid(property, value)) {
                return List.of(declaration);
            }
            warnings.warn(UnresolvedReferenceWarning.Kind.INVALID_VALUE, name, "Invalid value '" + value + "'");
            return List.of();
        }

        if (registry.isRegistered(name)) {
            return List.of(declaration);
        }
        warnings.warn(UnresolvedReferenceWarning.Kind.UNKNOWN_PROPERTY, name, "Unknown property");
        return List.of();
    }
}
