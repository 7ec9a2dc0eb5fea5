package screennav.detect;

import java.util.ArrayList;
import java.util.List;

import static screennav.detect.NormalizedElementSet.*;

/**
 * A parsed signature selector.
 *
 * <p>Supported forms:
 * <ul>
 *   <li>{@code :id/foo}, {@code pkg:id/foo}, {@code id:foo} (clone-safe identifier suffix)</li>
 *   <li>{@code identifier:<full>} or {@code resource-id:<full>} (exact identifier)</li>
 *   <li>{@code text:<t>}, {@code text-lower:<t>}</li>
 *   <li>{@code label:<l>}, {@code content-desc:<l>}, {@code label-lower:<l>}</li>
 *   <li>{@code contains:<s>} (case-insensitive substring of any text or label)</li>
 *   <li>{@code class:<full>}, {@code class-short:<name>}, or a bare capitalized word
 *       such as {@code VideoView}</li>
 *   <li>{@code clickable:<label-or-text>}</li>
 *   <li>any other bare value: label, text or identifier suffix</li>
 *   <li>{@code A OR B [OR C...]}: any of the above</li>
 * </ul>
 *
 * <p>Selectors are parsed once and matched many times; instances are immutable.
 */
public final class Selector {

    public enum Kind {
        ID, IDENTIFIER, TEXT, TEXT_LOWER, LABEL, LABEL_LOWER,
        CONTAINS, CLASS, CLASS_SHORT, CLICKABLE, ANY, ANY_OF
    }

    private static final String OR = " OR ";

    private final String         raw;
    private final Kind           kind;
    private final String         value;
    private final List<Selector> alternatives;

    private Selector(String raw, Kind kind, String value, List<Selector> alternatives) {
        this.raw          = raw;
        this.kind         = kind;
        this.value        = value;
        this.alternatives = alternatives;
    }

    /**
     * Parses a selector string.
     *
     * @throws IllegalArgumentException if the selector or one of its alternatives is empty
     */
    public static Selector parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Empty selector");
        }
        String s = raw.trim();
        if (s.contains(OR)) {
            List<Selector> parts = new ArrayList<>();
            for (String part : s.split(OR)) {
                parts.add(parseSingle(part.trim(), raw));
            }
            return new Selector(raw, Kind.ANY_OF, null, List.copyOf(parts));
        }
        return parseSingle(s, raw);
    }

    private static Selector parseSingle(String s, String raw) {
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Empty alternative in selector: '" + raw + "'");
        }
        if (s.startsWith("contains:"))     return single(s, Kind.CONTAINS,    rest(s, "contains:").toLowerCase());
        if (s.startsWith("identifier:"))   return single(s, Kind.IDENTIFIER,  rest(s, "identifier:"));
        if (s.startsWith("resource-id:"))  return single(s, Kind.IDENTIFIER,  rest(s, "resource-id:"));
        if (s.startsWith("id:"))           return single(s, Kind.ID,          rest(s, "id:"));
        if (s.startsWith("text-lower:"))   return single(s, Kind.TEXT_LOWER,  rest(s, "text-lower:").toLowerCase());
        if (s.startsWith("text:"))         return single(s, Kind.TEXT,        rest(s, "text:"));
        if (s.startsWith("label-lower:"))  return single(s, Kind.LABEL_LOWER, rest(s, "label-lower:").toLowerCase());
        if (s.startsWith("label:"))        return single(s, Kind.LABEL,       rest(s, "label:"));
        if (s.startsWith("content-desc:")) return single(s, Kind.LABEL,       rest(s, "content-desc:"));
        if (s.startsWith("class-short:"))  return single(s, Kind.CLASS_SHORT, rest(s, "class-short:"));
        if (s.startsWith("class:"))        return single(s, Kind.CLASS,       rest(s, "class:"));
        if (s.startsWith("clickable:"))    return single(s, Kind.CLICKABLE,   rest(s, "clickable:"));
        if (s.contains(":id/"))            return single(s, Kind.ID,          ElementNormalizer.idSuffix(s));

        if (Character.isUpperCase(s.charAt(0)) && s.indexOf(':') < 0 && s.chars().noneMatch(Character::isWhitespace)) {
            return single(s, Kind.CLASS_SHORT, s);
        }
        return single(s, Kind.ANY, s);
    }

    private static Selector single(String raw, Kind kind, String value) {
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Selector has no value: '" + raw + "'");
        }
        return new Selector(raw, kind, value, List.of());
    }

    private static String rest(String s, String prefix) {
        return s.substring(prefix.length());
    }

    /** True if the element set satisfies this selector. */
    public boolean matches(NormalizedElementSet elements) {
        return switch (kind) {
            case ID          -> elements.contains(ID + value);
            case IDENTIFIER  -> elements.contains(IDENTIFIER + value);
            case TEXT        -> elements.contains(TEXT + value);
            case TEXT_LOWER  -> elements.contains(TEXT_LOWER + value);
            case LABEL       -> elements.contains(LABEL + value);
            case LABEL_LOWER -> elements.contains(LABEL_LOWER + value);
            case CONTAINS    -> elements.anyTextOrLabelContains(value);
            case CLASS       -> elements.contains(CLASS + value);
            case CLASS_SHORT -> elements.contains(CLASS_SHORT + value);
            case CLICKABLE   -> elements.contains(CLICKABLE + value);
            case ANY         -> elements.contains(LABEL + value)
                                || elements.contains(TEXT + value)
                                || elements.contains(ID + value);
            case ANY_OF      -> alternatives.stream().anyMatch(a -> a.matches(elements));
        };
    }

    public String raw()                    { return raw; }
    public Kind kind()                     { return kind; }
    public String value()                  { return value; }
    public List<Selector> alternatives()   { return alternatives; }

    @Override
    public String toString() {
        return raw;
    }
}
