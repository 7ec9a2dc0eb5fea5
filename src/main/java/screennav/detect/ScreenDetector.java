package screennav.detect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import screennav.device.DeviceDriver;
import screennav.device.DriverException;
import screennav.model.ScreenCandidate;
import screennav.model.ScreenDetectionResult;
import screennav.model.ScreenSignature;
import screennav.model.SignatureDump;
import screennav.navigator.NavigatorConfig;
import screennav.signature.SignatureStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static screennav.detect.NormalizedElementSet.*;

/**
 * Identifies the current screen of one device by scoring every signature of
 * an app against a single normalized UI dump.
 *
 * <p>The normalized dump is cached for {@link NavigatorConfig#getCacheTtlMs()}
 * so that back-to-back detections (detect, then a popup check) share one
 * round trip to the device. Navigation verification always forces a refresh.
 *
 * <p>Detection never throws: a failed dump or an app without signatures is
 * reported as an {@code unknown} result with {@code error} set.
 */
public class ScreenDetector {

    private static final Logger log = LoggerFactory.getLogger(ScreenDetector.class);

    private static final int UNKNOWN_LOG_LIMIT = 5;

    private final DeviceDriver          driver;
    private final SignatureStore        signatures;
    private final SignatureScorer       scorer;
    private final DetectionStatsTracker stats;
    private final Clock                 clock;
    private final long                  cacheTtlMs;
    private final double                confidenceFloor;
    private final double                confidentThreshold;
    private final int                   maxCandidates;

    private final ReentrantLock        cacheLock = new ReentrantLock();
    private NormalizedElementSet       cachedElements;
    private long                       cachedAtMs;

    public ScreenDetector(DeviceDriver driver, SignatureStore signatures, NavigatorConfig config) {
        this(driver, signatures, config, Clock.systemUTC());
    }

    public ScreenDetector(DeviceDriver driver, SignatureStore signatures, NavigatorConfig config, Clock clock) {
        this.driver             = driver;
        this.signatures         = signatures;
        this.scorer             = new SignatureScorer();
        this.stats              = new DetectionStatsTracker();
        this.clock              = clock;
        this.cacheTtlMs         = config.getCacheTtlMs();
        this.confidenceFloor    = config.getConfidenceFloor();
        this.confidentThreshold = config.getConfidentThreshold();
        this.maxCandidates      = config.getMaxCandidates();
    }

    // ── Detection ─────────────────────────────────────────────────────────

    public ScreenDetectionResult detect(String appId) {
        return detect(appId, false);
    }

    /**
     * Detects the current screen of {@code appId}.
     *
     * @param forceRefresh ignore the cached dump and ask the device for a new one
     */
    public ScreenDetectionResult detect(String appId, boolean forceRefresh) {
        long start = System.nanoTime();

        NormalizedElementSet elements;
        try {
            elements = elements(forceRefresh);
        } catch (DriverException e) {
            log.error("[{}] UI dump failed: {}", driver.getSerial(), e.getMessage());
            return ScreenDetectionResult.failed(appId, "Failed to dump UI hierarchy: " + e.getMessage(), elapsedMs(start));
        }

        List<ScreenSignature> candidates = signatures.get(appId);
        if (candidates.isEmpty()) {
            return ScreenDetectionResult.failed(appId, "No signatures registered for app: " + appId, elapsedMs(start));
        }

        SignatureScorer.SignatureScore best = null;
        List<SignatureScorer.SignatureScore> nonZero = new ArrayList<>();
        for (ScreenSignature sig : candidates) {
            SignatureScorer.SignatureScore s = scorer.score(sig, elements);
            if (s.score() <= 0.0) continue;
            nonZero.add(s);
            // Strictly greater: on ties the earlier (higher-priority) signature stays
            if (best == null || s.score() > best.score()) {
                best = s;
            }
        }
        // Stable: equal scores keep priority order
        nonZero.sort(Comparator.comparingDouble(SignatureScorer.SignatureScore::score).reversed());

        double elapsed = elapsedMs(start);
        ScreenDetectionResult result;
        if (best != null && best.score() >= confidenceFloor) {
            ScreenSignature winner = best.signature();
            SignatureScorer.SignatureScore accepted = best;
            result = ScreenDetectionResult.builder(winner.getAppId(), winner.getScreenId())
                    .confidence(best.score())
                    .detectionTimeMs(elapsed)
                    .matchedElements(best.matched())
                    .candidates(topCandidates(nonZero.stream().filter(s -> s != accepted).toList()))
                    .description(winner.getDescription())
                    .safeState(winner.isSafeState())
                    .recoveryAction(winner.getRecoveryAction())
                    .confidentThreshold(confidentThreshold)
                    .build();
            log.debug("[{}] Detected {} ({}) in {} ms", driver.getSerial(), result.getFullId(),
                    String.format("%.2f", best.score()), String.format("%.1f", elapsed));
        } else {
            result = ScreenDetectionResult.builder(appId, ScreenDetectionResult.UNKNOWN_SCREEN)
                    .confidence(best != null ? best.score() : 0.0)
                    .detectionTimeMs(elapsed)
                    .candidates(topCandidates(nonZero))
                    .confidentThreshold(confidentThreshold)
                    .build();
            logUnknown(appId, elements, result.getCandidates());
        }

        stats.record(elapsed, result.isUnknown());
        return result;
    }

    /**
     * Normalized elements of the current screen, from cache when younger than
     * the TTL and {@code forceRefresh} is false.
     *
     * @throws DriverException if a fresh dump was needed and failed
     */
    public NormalizedElementSet elements(boolean forceRefresh) throws DriverException {
        cacheLock.lock();
        try {
            long now = clock.millis();
            if (!forceRefresh && cachedElements != null && now - cachedAtMs < cacheTtlMs) {
                return cachedElements;
            }
            NormalizedElementSet fresh = ElementNormalizer.normalize(driver.dumpUiTree());
            cachedElements = fresh;
            cachedAtMs     = clock.millis();
            return fresh;
        } finally {
            cacheLock.unlock();
        }
    }

    public void invalidateCache() {
        cacheLock.lock();
        try {
            cachedElements = null;
            cachedAtMs     = 0L;
        } finally {
            cacheLock.unlock();
        }
    }

    // ── Signature authoring ───────────────────────────────────────────────

    /**
     * Takes a fresh dump and groups its elements by kind, as raw material for
     * a new signature after an {@code unknown} detection.
     *
     * @throws DriverException if the dump failed
     */
    public SignatureDump dumpForSignature() throws DriverException {
        NormalizedElementSet elements = elements(true);
        return new SignatureDump(
                clock.instant(),
                elements.valuesOf(ID),
                elements.valuesOf(LABEL),
                elements.valuesOf(TEXT),
                elements.valuesOf(CLASS_SHORT),
                elements.valuesOf(CLICKABLE),
                elements.size(),
                SignatureDump.HINT);
    }

    public DetectionStats getStats() {
        return stats.snapshot();
    }

    public SignatureScorer getScorer() {
        return scorer;
    }

    public String getSerial() {
        return driver.getSerial();
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private List<ScreenCandidate> topCandidates(List<SignatureScorer.SignatureScore> sorted) {
        return sorted.stream()
                .limit(maxCandidates)
                .map(s -> new ScreenCandidate(s.signature().getScreenId(), s.score()))
                .toList();
    }

    private void logUnknown(String appId, NormalizedElementSet elements, List<ScreenCandidate> candidates) {
        log.warn("[{}] Unknown screen for {}. Key elements:\n  ids: {}\n  labels: {}\n  texts: {}\n  candidates: {}",
                driver.getSerial(), appId,
                head(elements.valuesOf(ID)),
                head(elements.valuesOf(LABEL)),
                head(elements.valuesOf(TEXT)),
                candidates);
    }

    private static List<String> head(List<String> values) {
        return values.size() > UNKNOWN_LOG_LIMIT ? values.subList(0, UNKNOWN_LOG_LIMIT) : values;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
