package screennav.signature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import screennav.detect.Selector;
import screennav.model.ScreenSignature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-app registry of {@link ScreenSignature}s.
 *
 * <p>Each app maps to an immutable list sorted by descending priority
 * (stable for equal priorities). Registration replaces the whole list, so
 * readers never see a partially updated set and need no lock.
 *
 * <p>Signatures of the shared app ({@code android_system} by default) are
 * merged into every other app's list: permission dialogs and crash popups
 * can appear over any app.
 */
public class SignatureStore {

    private static final Logger log = LoggerFactory.getLogger(SignatureStore.class);

    private static final Comparator<ScreenSignature> BY_PRIORITY_DESC =
            Comparator.comparingInt(ScreenSignature::getPriority).reversed();

    private final Map<String, List<ScreenSignature>> byApp = new ConcurrentHashMap<>();
    private final String sharedAppId;

    public SignatureStore(String sharedAppId) {
        this.sharedAppId = sharedAppId;
    }

    /**
     * Replaces the signatures of {@code appId}.
     *
     * @throws IllegalArgumentException if screen ids repeat or a selector cannot be parsed
     */
    public void register(String appId, List<ScreenSignature> signatures) {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId is required");
        }
        Set<String> seen = new TreeSet<>();
        List<ScreenSignature> bound = new ArrayList<>(signatures.size());
        for (ScreenSignature sig : signatures) {
            if (!seen.add(sig.getScreenId())) {
                throw new IllegalArgumentException("Duplicate screenId '" + sig.getScreenId() + "' for app " + appId);
            }
            validateSelectors(sig);
            bound.add(sig.withAppId(appId));
        }
        bound.sort(BY_PRIORITY_DESC);
        byApp.put(appId, List.copyOf(bound));
        log.info("Registered {} signature(s) for app '{}'", bound.size(), appId);
    }

    /** Signatures of {@code appId} merged with the shared overlay. */
    public List<ScreenSignature> get(String appId) {
        return get(appId, true);
    }

    public List<ScreenSignature> get(String appId, boolean includeShared) {
        List<ScreenSignature> own = byApp.getOrDefault(appId, List.of());
        if (!includeShared || sharedAppId.equals(appId)) {
            return own;
        }
        List<ScreenSignature> shared = byApp.getOrDefault(sharedAppId, List.of());
        if (shared.isEmpty()) {
            return own;
        }
        List<ScreenSignature> merged = new ArrayList<>(own.size() + shared.size());
        merged.addAll(own);
        merged.addAll(shared);
        merged.sort(BY_PRIORITY_DESC);
        return List.copyOf(merged);
    }

    public Optional<ScreenSignature> find(String appId, String screenId) {
        return byApp.getOrDefault(appId, List.of()).stream()
                .filter(s -> s.getScreenId().equals(screenId))
                .findFirst();
    }

    /** Screen ids of {@code appId} only, in priority order. */
    public List<String> screenIds(String appId) {
        return byApp.getOrDefault(appId, List.of()).stream()
                .map(ScreenSignature::getScreenId)
                .toList();
    }

    /** Screen ids flagged as safe states for {@code appId}. */
    public List<String> getSafeStates(String appId) {
        return byApp.getOrDefault(appId, List.of()).stream()
                .filter(ScreenSignature::isSafeState)
                .map(ScreenSignature::getScreenId)
                .toList();
    }

    public Set<String> appIds() {
        return new TreeSet<>(byApp.keySet());
    }

    public boolean hasApp(String appId) {
        return byApp.containsKey(appId);
    }

    public String getSharedAppId() {
        return sharedAppId;
    }

    private static void validateSelectors(ScreenSignature sig) {
        List<String> all = new ArrayList<>();
        all.addAll(sig.getRequired());
        all.addAll(sig.getForbidden());
        all.addAll(sig.getUnique());
        all.addAll(sig.getOptional());
        for (String selector : all) {
            try {
                Selector.parse(selector);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Signature " + sig.getScreenId() + ": " + e.getMessage(), e);
            }
        }
    }
}
