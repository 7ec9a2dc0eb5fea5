package screennav.detect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of normalized element tokens extracted from one UI dump.
 *
 * <p>Tokens have the form {@code kind:value}, e.g. {@code id:search_bar},
 * {@code label:Like}, {@code class-short:VideoView}. Membership is O(1).
 */
public final class NormalizedElementSet {

    public static final String IDENTIFIER  = "identifier:";
    public static final String ID          = "id:";
    public static final String LABEL       = "label:";
    public static final String LABEL_LOWER = "label-lower:";
    public static final String TEXT        = "text:";
    public static final String TEXT_LOWER  = "text-lower:";
    public static final String CLASS       = "class:";
    public static final String CLASS_SHORT = "class-short:";
    public static final String CLICKABLE   = "clickable:";

    private static final NormalizedElementSet EMPTY = new NormalizedElementSet(Set.of());

    private final Set<String>  tokens;
    /** Lower-cased text and label values, scanned by {@code contains:} selectors. */
    private final List<String> searchable;

    NormalizedElementSet(Set<String> tokens) {
        this.tokens = Collections.unmodifiableSet(tokens);
        List<String> s = new ArrayList<>();
        for (String t : tokens) {
            if (t.startsWith(TEXT_LOWER)) {
                s.add(t.substring(TEXT_LOWER.length()));
            } else if (t.startsWith(LABEL_LOWER)) {
                s.add(t.substring(LABEL_LOWER.length()));
            }
        }
        this.searchable = List.copyOf(s);
    }

    public static NormalizedElementSet empty() {
        return EMPTY;
    }

    /** Builds a set from raw tokens; mostly for tests. */
    public static NormalizedElementSet of(String... tokens) {
        return new NormalizedElementSet(new HashSet<>(List.of(tokens)));
    }

    public boolean contains(String token) {
        return tokens.contains(token);
    }

    /** True if any text or label contains {@code lowerNeedle} (already lower-cased). */
    public boolean anyTextOrLabelContains(String lowerNeedle) {
        for (String s : searchable) {
            if (s.contains(lowerNeedle)) return true;
        }
        return false;
    }

    /** Sorted values of all tokens of one kind, prefix stripped. */
    public List<String> valuesOf(String prefix) {
        return tokens.stream()
                .filter(t -> t.startsWith(prefix))
                .map(t -> t.substring(prefix.length()))
                .sorted()
                .toList();
    }

    public Set<String> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    @Override
    public String toString() {
        return "NormalizedElementSet{" + tokens.size() + " tokens}";
    }
}
