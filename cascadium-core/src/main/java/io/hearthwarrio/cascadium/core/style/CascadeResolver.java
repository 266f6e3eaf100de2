package io.hearthwarrio.cascadium.core.style;

import io.hearthwarrio.cascadium.core.UnresolvedReferenceWarning;
import io.hearthwarrio.cascadium.core.WarningSink;
import io.hearthwarrio.cascadium.core.css.Declaration;
import io.hearthwarrio.cascadium.core.css.Origin;
import io.hearthwarrio.cascadium.core.css.Rule;
import io.hearthwarrio.cascadium.core.css.SelectorMatcher;
import io.hearthwarrio.cascadium.core.css.Specificity;
import io.hearthwarrio.cascadium.core.css.Stylesheet;
import io.hearthwarrio.cascadium.core.css.StylesheetParser;
import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Computes one {@link ComputedStyle} per element from matching rules, inline declarations, inheritance and
 * initial values.
 * <p>
 * Candidates for a property are ordered by importance, origin, specificity and source order (all descending);
 * the first candidate whose value coerces wins. Without a candidate, inherited properties copy the parent's
 * value and the rest take their initial value.
 * <p>
 * {@code font-size} is resolved first so that {@code em} lengths of the same element can use it, then
 * {@code color} so that {@code currentcolor} can.
 */
public final class CascadeResolver {

    private static final Comparator<Candidate> CASCADE_ORDER = Comparator
            .comparing((Candidate c) -> c.declaration.isImportant())
            .thenComparingInt(c -> c.origin.rank())
            .thenComparing(c -> c.specificity)
            .thenComparingInt(c -> c.sourceOrder)
            .thenComparingInt(c -> c.position)
            .reversed();

    private final List<Rule> rules;
    private final PropertyRegistry registry;
    private final SelectorMatcher matcher;
    private final WarningSink warnings;
    private final StylesheetParser inlineParser;

    public CascadeResolver(List<Stylesheet> stylesheets) {
        this(stylesheets, new PropertyRegistry(), new SelectorMatcher(), WarningSink.IGNORE);
    }

    /**
     * @param stylesheets stylesheets in cascade order (user agent first); their rules keep their source order
     * @param registry    extension properties to keep
     * @param matcher     selector matcher
     * @param warnings    receives invalid inline declarations and values that fail coercion
     */
    public CascadeResolver(
            List<Stylesheet> stylesheets,
            PropertyRegistry registry,
            SelectorMatcher matcher,
            WarningSink warnings
    ) {
        Objects.requireNonNull(stylesheets, "stylesheets must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.warnings = Objects.requireNonNull(warnings, "warnings must not be null");
        List<Rule> all = new ArrayList<>();
        for (Stylesheet s : stylesheets) {
            all.addAll(s.getRules());
        }
        this.rules = List.copyOf(all);
        this.inlineParser = new StylesheetParser(new StyleDeclarationProcessor(registry), warnings);
    }

    /**
     * Resolves every element of the document, parents before children.
     *
     * @return styles indexed like {@link Document#getElements()}
     */
    public List<ComputedStyle> resolve(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        List<ComputedStyle> styles = new ArrayList<>(document.size());
        for (Element e : document.getElements()) {
            Element parent = e.getParent();
            styles.add(computeStyle(e, parent == null ? null : styles.get(parent.getIndex())));
        }
        return styles;
    }

    /**
     * Rules whose selector matches the element, in source order.
     */
    public List<Rule> matchingRules(Element element) {
        List<Rule> out = new ArrayList<>();
        for (Rule r : rules) {
            if (matcher.matches(r.getSelector(), element)) {
                out.add(r);
            }
        }
        return out;
    }

    /**
     * Computes the style of one element.
     *
     * @param element     element to style
     * @param parentStyle computed style of the parent, or {@code null} for the root
     */
    public ComputedStyle computeStyle(Element element, ComputedStyle parentStyle) {
        Objects.requireNonNull(element, "element must not be null");
        ComputedStyle parent = parentStyle == null ? ComputedStyle.initial() : parentStyle;

        Map<String, List<Candidate>> byProperty = collect(element);
        Map<Property, StyleValue> values = new EnumMap<>(Property.class);

        ValueCoercer.Context parentContext = new ValueCoercer.Context(
                parent.getFontSize(), parent, parent.getColor(Property.COLOR));
        StyleValue fontSize = cascade(Property.FONT_SIZE, byProperty, parent, parentContext, element);
        values.put(Property.FONT_SIZE, fontSize);
        double fontSizePx = ((Length) fontSize).getValue();

        ValueCoercer.Context colorContext = new ValueCoercer.Context(
                fontSizePx, parent, parent.getColor(Property.COLOR));
        Color color = (Color) cascade(Property.COLOR, byProperty, parent, colorContext, element);
        values.put(Property.COLOR, color);

        ValueCoercer.Context context = new ValueCoercer.Context(fontSizePx, parent, color);
        for (Property p : Property.values()) {
            if (p != Property.FONT_SIZE && p != Property.COLOR) {
                values.put(p, cascade(p, byProperty, parent, context, element));
            }
        }
        zeroHiddenBorders(values);

        Map<String, String> extensions = new LinkedHashMap<>();
        for (Map.Entry<String, List<Candidate>> e : byProperty.entrySet()) {
            String name = e.getKey();
            if (Property.byName(name) == null && registry.isRegistered(name)) {
                String value = cascadeExtension(name, e.getValue(), parent);
                if (value != null) {
                    extensions.put(name, value);
                }
            }
        }
        return new ComputedStyle(values, extensions);
    }

    private Map<String, List<Candidate>> collect(Element element) {
        List<Candidate> candidates = new ArrayList<>();
        int position = 0;
        for (Rule rule : rules) {
            if (!matcher.matches(rule.getSelector(), element)) {
                continue;
            }
            for (Declaration d : rule.getDeclarations()) {
                position = add(candidates, d, rule.getOrigin(), rule.specificity(), rule.getSourceOrder(), position);
            }
        }
        String inline = element.getInlineStyle();
        if (!inline.isBlank()) {
            for (Declaration d : inlineParser.parseDeclarations(inline)) {
                position = add(candidates, d, Origin.INLINE, Specificity.INLINE, Integer.MAX_VALUE, position);
            }
        }
        candidates.sort(CASCADE_ORDER);

        Map<String, List<Candidate>> byProperty = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            byProperty.computeIfAbsent(c.declaration.getProperty(), k -> new ArrayList<>()).add(c);
        }
        return byProperty;
    }

    private int add(List<Candidate> out, Declaration d, Origin origin, Specificity specificity, int order, int position) {
        if (!Shorthands.isShorthand(d.getProperty())) {
            out.add(new Candidate(d, origin, specificity, order, position));
            return position + 1;
        }
        List<Declaration> longhands = Shorthands.expand(d);
        if (longhands == null) {
            warnings.warn(UnresolvedReferenceWarning.Kind.INVALID_VALUE, d.getProperty(),
                    "Invalid value '" + d.getValue() + "'");
            return position + 1;
        }
        for (Declaration l : longhands) {
            out.add(new Candidate(l, origin, specificity, order, position));
        }
        return position + 1;
    }

    private StyleValue cascade(
            Property property,
            Map<String, List<Candidate>> byProperty,
            ComputedStyle parent,
            ValueCoercer.Context context,
            Element element
    ) {
        List<Candidate> candidates = byProperty.get(property.cssName());
        if (candidates != null) {
            for (Candidate c : candidates) {
                String raw = c.declaration.getValue();
                switch (raw.toLowerCase(Locale.ROOT)) {
                    case "inherit":
                        return parent.get(property);
                    case "initial":
                        return initialValue(property, context);
                    case "unset":
                        return property.isInherited() ? parent.get(property) : initialValue(property, context);
                    default:
                        break;
                }
                StyleValue value = ValueCoercer.coerce(property, raw, context);
                if (value != null) {
                    return value;
                }
                warnings.warn(UnresolvedReferenceWarning.Kind.INVALID_VALUE, property.cssName(),
                        "Invalid value '" + raw + "' for " + element.describe());
            }
        }
        return property.isInherited() ? parent.get(property) : initialValue(property, context);
    }

    private static StyleValue initialValue(Property property, ValueCoercer.Context context) {
        StyleValue initial = property.initialValue();
        if (initial instanceof Keyword && ((Keyword) initial).is("currentcolor")) {
            return ValueCoercer.coerce(property, "currentcolor", context);
        }
        return initial;
    }

    private static String cascadeExtension(String name, List<Candidate> candidates, ComputedStyle parent) {
        String raw = candidates.get(0).declaration.getValue();
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "inherit":
                return parent.getExtension(name);
            case "initial":
            case "unset":
                return null;
            default:
                return raw;
        }
    }

    private static void zeroHiddenBorders(Map<Property, StyleValue> values) {
        zeroIfHidden(values, Property.BORDER_TOP_STYLE, Property.BORDER_TOP_WIDTH);
        zeroIfHidden(values, Property.BORDER_RIGHT_STYLE, Property.BORDER_RIGHT_WIDTH);
        zeroIfHidden(values, Property.BORDER_BOTTOM_STYLE, Property.BORDER_BOTTOM_WIDTH);
        zeroIfHidden(values, Property.BORDER_LEFT_STYLE, Property.BORDER_LEFT_WIDTH);
    }

    private static void zeroIfHidden(Map<Property, StyleValue> values, Property style, Property width) {
        String s = ((Keyword) values.get(style)).getName();
        if ("none".equals(s) || "hidden".equals(s)) {
            values.put(width, Length.ZERO);
        }
    }

    private static final class Candidate {
        private final Declaration declaration;
        private final Origin origin;
        private final Specificity specificity;
        private final int sourceOrder;
        private final int position;

        Candidate(Declaration declaration, Origin origin, Specificity specificity, int sourceOrder, int position) {
            this.declaration = declaration;
            this.origin = origin;
            this.specificity = specificity;
            this.sourceOrder = sourceOrder;
            this.position = position;
        }
    }
}
