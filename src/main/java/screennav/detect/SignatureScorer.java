package screennav.detect;

import screennav.model.ScreenSignature;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores one {@link ScreenSignature} against a {@link NormalizedElementSet}.
 *
 * <ol>
 *   <li>any forbidden selector present: 0.0</li>
 *   <li>any unique selector present: 1.0</li>
 *   <li>no required selectors, or none of them present: 0.0</li>
 *   <li>otherwise {@code matched/required + 0.1 * matchedOptional/optional}, capped at 1.0</li>
 * </ol>
 *
 * Parsed selectors are cached by their raw string, so each is parsed once per scorer.
 */
public class SignatureScorer {

    private final Map<String, Selector> parsed = new ConcurrentHashMap<>();

    /** Score of one signature plus the selectors that contributed, e.g. {@code required::id/tab_bar}. */
    public record SignatureScore(ScreenSignature signature, double score, List<String> matched) {

        static SignatureScore zero(ScreenSignature signature) {
            return new SignatureScore(signature, 0.0, List.of());
        }
    }

    public SignatureScore score(ScreenSignature signature, NormalizedElementSet elements) {
        for (String forbidden : signature.getForbidden()) {
            if (matches(forbidden, elements)) {
                return SignatureScore.zero(signature);
            }
        }

        for (String unique : signature.getUnique()) {
            if (matches(unique, elements)) {
                return new SignatureScore(signature, 1.0, List.of("unique:" + unique));
            }
        }

        List<String> required = signature.getRequired();
        if (required.isEmpty()) {
            return SignatureScore.zero(signature);
        }

        List<String> matched = new ArrayList<>();
        int requiredHits = 0;
        for (String r : required) {
            if (matches(r, elements)) {
                requiredHits++;
                matched.add("required:" + r);
            }
        }
        if (requiredHits == 0) {
            return SignatureScore.zero(signature);
        }

        double score = (double) requiredHits / required.size();

        List<String> optional = signature.getOptional();
        if (!optional.isEmpty()) {
            int optionalHits = 0;
            for (String o : optional) {
                if (matches(o, elements)) {
                    optionalHits++;
                    matched.add("optional:" + o);
                }
            }
            score += 0.1 * optionalHits / optional.size();
        }

        return new SignatureScore(signature, Math.min(1.0, score), List.copyOf(matched));
    }

    public boolean matches(String selector, NormalizedElementSet elements) {
        return parsed.computeIfAbsent(selector, Selector::parse).matches(elements);
    }
}
