package screennav.detect;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import screennav.model.CatalogIO;
import screennav.model.PatternMatch;
import screennav.model.PopupPattern;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * One-shot check of the current screen against a list of known popups.
 *
 * <p>Each pattern's {@code detect} selector is evaluated with the same
 * matcher used for signatures. Dismissing is left to the caller, which gets
 * the pattern's {@code dismiss} selector back in the match.
 */
public class PopupPatternChecker {

    private static final Logger log = LoggerFactory.getLogger(PopupPatternChecker.class);

    private static final String DEFAULT_PATTERNS_RESOURCE = "popup-patterns.json";

    private final SignatureScorer scorer;

    public PopupPatternChecker(SignatureScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Returns the patterns whose detect selector matches, in input order.
     * Patterns with a blank or malformed detect selector are skipped with a warning.
     */
    public List<PatternMatch> check(NormalizedElementSet elements, List<PopupPattern> patterns) {
        List<PatternMatch> matches = new ArrayList<>();
        for (PopupPattern p : patterns) {
            if (p.detect() == null || p.detect().isBlank()) {
                log.warn("Popup pattern '{}' has no detect selector, skipped", p.name());
                continue;
            }
            try {
                if (scorer.matches(p.detect(), elements)) {
                    log.info("Popup detected: {} ({})", p.name(), p.detect());
                    matches.add(new PatternMatch(p.name(), p.detect(), p.dismiss()));
                }
            } catch (IllegalArgumentException e) {
                log.warn("Popup pattern '{}' has an invalid selector: {}", p.name(), e.getMessage());
            }
        }
        return matches;
    }

    /** Patterns bundled in {@code popup-patterns.json}. */
    public static List<PopupPattern> defaultPatterns() {
        try (InputStream is = PopupPatternChecker.class.getClassLoader()
                .getResourceAsStream(DEFAULT_PATTERNS_RESOURCE)) {
            if (is == null) {
                log.warn("{} not found on classpath, no default popup patterns", DEFAULT_PATTERNS_RESOURCE);
                return List.of();
            }
            return List.copyOf(CatalogIO.getMapper().readValue(is, new TypeReference<List<PopupPattern>>() {}));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFAULT_PATTERNS_RESOURCE, e);
        }
    }
}
