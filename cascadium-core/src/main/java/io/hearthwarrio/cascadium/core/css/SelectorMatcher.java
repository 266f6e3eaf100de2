package io.hearthwarrio.cascadium.core.css;

import io.hearthwarrio.cascadium.core.dom.Element;

import java.util.List;
import java.util.Objects;

/**
 * Matches selectors against elements in their ancestor and sibling context.
 * <p>
 * Matching starts at the subject (rightmost compound) and walks outward, so a mismatch on the element
 * itself fails before any ancestor is visited. Descendant and general-sibling combinators backtrack
 * over every candidate.
 */
public final class SelectorMatcher {

    private final InteractionState interactionState;

    public SelectorMatcher() {
        this(InteractionState.NONE);
    }

    public SelectorMatcher(InteractionState interactionState) {
        this.interactionState = Objects.requireNonNull(interactionState, "interactionState must not be null");
    }

    public boolean matches(Selector selector, Element element) {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(element, "element must not be null");
        List<CompoundSelector> compounds = selector.getCompounds();
        return matchFrom(selector, compounds.size() - 1, element);
    }

    private boolean matchFrom(Selector selector, int compoundIndex, Element element) {
        if (!matchesCompound(selector.getCompounds().get(compoundIndex), element)) {
            return false;
        }
        if (compoundIndex == 0) {
            return true;
        }
        Combinator combinator = selector.getCombinators().get(compoundIndex - 1);
        switch (combinator) {
            case CHILD: {
                Element parent = element.getParent();
                return parent != null && matchFrom(selector, compoundIndex - 1, parent);
            }
            case DESCENDANT: {
                for (Element a = element.getParent(); a != null; a = a.getParent()) {
                    if (matchFrom(selector, compoundIndex - 1, a)) {
                        return true;
                    }
                }
                return false;
            }
            case ADJACENT_SIBLING: {
                Element previous = element.getPreviousSibling();
                return previous != null && matchFrom(selector, compoundIndex - 1, previous);
            }
            case GENERAL_SIBLING: {
                for (Element s = element.getPreviousSibling(); s != null; s = s.getPreviousSibling()) {
                    if (matchFrom(selector, compoundIndex - 1, s)) {
                        return true;
                    }
                }
                return false;
            }
            default:
                return false;
        }
    }

    public boolean matchesCompound(CompoundSelector compound, Element element) {
        if (compound.getTagName() != null && !compound.getTagName().equals(element.getTagName())) {
            return false;
        }
        if (compound.getId() != null && !compound.getId().equals(element.getId())) {
            return false;
        }
        for (String c : compound.getClasses()) {
            if (!element.hasClass(c)) {
                return false;
            }
        }
        for (AttributeCondition a : compound.getAttributes()) {
            if (!a.matches(element)) {
                return false;
            }
        }
        for (PseudoClass p : compound.getPseudoClasses()) {
            if (!matchesPseudoClass(p, element)) {
                return false;
            }
        }
        return true;
    }

    private boolean matchesPseudoClass(PseudoClass pseudoClass, Element element) {
        Element parent = element.getParent();
        switch (pseudoClass.getKind()) {
            case FIRST_CHILD:
                return parent != null && element.getSiblingPosition() == 0;
            case LAST_CHILD:
                return parent != null && element.getSiblingPosition() == parent.getChildCount() - 1;
            case ONLY_CHILD:
                return parent != null && parent.getChildCount() == 1;
            case EMPTY:
                return element.getChildCount() == 0 && element.getTextContent().isEmpty();
            case NTH_CHILD:
                return parent != null && pseudoClass.matchesPosition(element.getSiblingPosition() + 1);
            case NTH_LAST_CHILD:
                return parent != null &&
                        pseudoClass.matchesPosition(parent.getChildCount() - element.getSiblingPosition());
            case NTH_OF_TYPE:
                return parent != null && pseudoClass.matchesPosition(positionOfType(element));
            case NOT:
                return !matchesCompound(pseudoClass.getNegated(), element);
            case DISABLED:
                return element.hasAttribute("disabled");
            case ENABLED:
                return isFormControl(element) && !element.hasAttribute("disabled");
            case CHECKED:
                return element.hasAttribute("checked") || element.hasAttribute("selected");
            case REQUIRED:
                return element.hasAttribute("required");
            case OPTIONAL:
                return isFormControl(element) && !element.hasAttribute("required");
            case HOVER:
                return interactionState.isHovered(element);
            case FOCUS:
                return interactionState.isFocused(element);
            case ACTIVE:
                return interactionState.isActive(element);
            default:
                return false;
        }
    }

    private static int positionOfType(Element element) {
        int position = 1;
        for (Element s = element.getPreviousSibling(); s != null; s = s.getPreviousSibling()) {
            if (s.getTagName().equals(element.getTagName())) {
                position++;
            }
        }
        return position;
    }

    private static boolean isFormControl(Element element) {
        switch (element.getTagName()) {
            case "input":
            case "button":
            case "select":
            case "textarea":
            case "option":
                return true;
            default:
                return false;
        }
    }
}
