package io.hearthwarrio.cascadium.core.css;

import io.hearthwarrio.cascadium.core.dom.Element;

import java.util.Objects;

/**
 * Attribute requirement of a compound selector, e.g. {@code [type="text"]} or {@code [data-qa^=login]}.
 */
public final class AttributeCondition {

    public enum Operator {
        /** {@code [name]} */
        EXISTS(""),
        /** {@code [name=value]} */
        EQUALS("="),
        /** {@code [name~=value]}: whitespace-separated word */
        INCLUDES("~="),
        /** {@code [name|=value]}: exact or followed by a hyphen */
        DASH_MATCH("|="),
        /** {@code [name^=value]} */
        PREFIX("^="),
        /** {@code [name$=value]} */
        SUFFIX("$="),
        /** {@code [name*=value]} */
        SUBSTRING("*=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final String name;
    private final Operator operator;
    private final String value;

    public AttributeCondition(String name, Operator operator, String value) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = value == null ? "" : value;
    }

    public String getName() {
        return name;
    }

    public Operator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    public boolean matches(Element element) {
        String actual = element.getAttribute(name);
        if (actual == null) {
            return false;
        }
        switch (operator) {
            case EXISTS:
                return true;
            case EQUALS:
                return actual.equals(value);
            case INCLUDES:
                if (value.isEmpty() || value.chars().anyMatch(Character::isWhitespace)) {
                    return false;
                }
                for (String word : actual.trim().split("\\s+")) {
                    if (word.equals(value)) {
                        return true;
                    }
                }
                return false;
            case DASH_MATCH:
                return actual.equals(value) || actual.startsWith(value + "-");
            case PREFIX:
                return !value.isEmpty() && actual.startsWith(value);
            case SUFFIX:
                return !value.isEmpty() && actual.endsWith(value);
            case SUBSTRING:
                return !value.isEmpty() && actual.contains(value);
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        if (operator == Operator.EXISTS) {
            return "[" + name + "]";
        }
        return "[" + name + operator.symbol() + "\"" + value + "\"]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeCondition)) return false;
        AttributeCondition that = (AttributeCondition) o;
        return name.equals(that.name) && operator == that.operator && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, operator, value);
    }
}
