package io.hearthwarrio.cascadium.core.style;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Extension properties recognized in addition to the built-in {@link Property} set.
 * <p>
 * Extension values are not typed or inherited; the winning declaration's text is exposed through
 * {@link ComputedStyle#getExtension(String)}. Registration is safe to call while other threads read.
 */
public final class PropertyRegistry {

    /**
     * Properties understood by the sprite painter.
     */
    public static final List<String> SPRITE_PROPERTIES =
            List.of("sprite-tint", "sprite-scale", "sprite-rotation", "sprite-alpha");

    private volatile Set<String> names = Collections.emptySet();

    public PropertyRegistry() {
    }

    /**
     * Registry with {@link #SPRITE_PROPERTIES} registered.
     */
    public static PropertyRegistry withSpriteProperties() {
        PropertyRegistry registry = new PropertyRegistry();
        for (String name : SPRITE_PROPERTIES) {
            registry.register(name);
        }
        return registry;
    }

    /**
     * Registers an extension property.
     *
     * @param name property name, stored lower-case
     * @return this registry
     * @throws IllegalArgumentException if the name is blank or names a built-in property or shorthand
     */
    public synchronized PropertyRegistry register(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String n = name.trim().toLowerCase(Locale.ROOT);
        if (n.isEmpty()) {
            throw new IllegalArgumentException("Property name must not be blank");
        }
        if (Property.byName(n) != null || Shorthands.isShorthand(n)) {
            throw new IllegalArgumentException("'" + n + "' is a built-in property");
        }
        Set<String> copy = new LinkedHashSet<>(names);
        copy.add(n);
        names = Collections.unmodifiableSet(copy);
        return this;
    }

    public boolean isRegistered(String name) {
        return name != null && names.contains(name.trim().toLowerCase(Locale.ROOT));
    }

    public Set<String> names() {
        return names;
    }

    @Override
    public String toString() {
        return "PropertyRegistry" + names;
    }
}
