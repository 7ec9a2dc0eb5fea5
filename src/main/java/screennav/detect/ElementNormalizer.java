package screennav.detect;

import screennav.model.UiNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import static screennav.detect.NormalizedElementSet.*;

/**
 * Flattens a {@link UiNode} tree into a {@link NormalizedElementSet}.
 *
 * <p>For each visible node it emits the full and the clone-safe identifier
 * ({@code id:<suffix>}, which ignores the package so cloned apps with a
 * renamed package still match), text and label in exact and lower-case
 * form, full and short class name, and {@code clickable:<label-or-text>}
 * for clickable nodes. Blank attributes emit nothing.
 *
 * <p>A node reported as invisible is dropped with its whole subtree; a node
 * with zero-area bounds is dropped but its children are still visited.
 */
public final class ElementNormalizer {

    private ElementNormalizer() {}

    public static NormalizedElementSet normalize(UiNode root) {
        if (root == null) return NormalizedElementSet.empty();

        Set<String> tokens = new HashSet<>();
        Deque<UiNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            UiNode node = stack.pop();
            if (Boolean.FALSE.equals(node.getVisible())) continue;

            if (node.getBounds() == null || node.getBounds().hasArea()) {
                emit(node, tokens);
            }
            for (UiNode child : node.getChildren()) {
                if (child != null) stack.push(child);
            }
        }
        return new NormalizedElementSet(tokens);
    }

    /**
     * Clone-safe part of a resource identifier: what follows the last
     * {@code :id/}, else the last {@code /}, else the whole string.
     */
    public static String idSuffix(String identifier) {
        int idx = identifier.lastIndexOf(":id/");
        if (idx >= 0) return identifier.substring(idx + 4);
        idx = identifier.lastIndexOf('/');
        if (idx >= 0) return identifier.substring(idx + 1);
        return identifier;
    }

    private static void emit(UiNode node, Set<String> tokens) {
        String identifier = node.getIdentifier();
        if (notBlank(identifier)) {
            tokens.add(IDENTIFIER + identifier);
            String suffix = idSuffix(identifier);
            if (!suffix.isEmpty()) tokens.add(ID + suffix);
        }

        String label = node.getLabel();
        if (notBlank(label)) {
            tokens.add(LABEL + label);
            tokens.add(LABEL_LOWER + label.toLowerCase());
        }

        String text = node.getText();
        if (notBlank(text)) {
            tokens.add(TEXT + text);
            tokens.add(TEXT_LOWER + text.toLowerCase());
        }

        String className = node.getClassName();
        if (notBlank(className)) {
            tokens.add(CLASS + className);
            tokens.add(CLASS_SHORT + className.substring(className.lastIndexOf('.') + 1));
        }

        if (node.isClickable()) {
            if (notBlank(label)) {
                tokens.add(CLICKABLE + label);
            } else if (notBlank(text)) {
                tokens.add(CLICKABLE + text);
            }
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
