package screennav.navigator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Reads {@code screennav.properties} from the classpath and exposes typed
 * detection, navigation and service settings with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code screennav.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class NavigatorConfig {

    private static final Logger log = LoggerFactory.getLogger(NavigatorConfig.class);

    private static final String CONFIG_FILE       = "screennav.properties";
    private static final String CONFIG_LOCAL_FILE = "screennav.local.properties";

    // Property keys
    private static final String KEY_CACHE_TTL          = "detector.cache.ttl.ms";
    private static final String KEY_CONFIDENCE_FLOOR   = "detector.confidence.floor";
    private static final String KEY_CONFIDENT          = "detector.confident.threshold";
    private static final String KEY_MAX_CANDIDATES     = "detector.max.candidates";
    private static final String KEY_SHARED_APP         = "detector.shared.app.id";
    private static final String KEY_MAX_ATTEMPTS       = "navigator.max.attempts";
    private static final String KEY_VERIFY_EACH_STEP   = "navigator.verify.each.step";
    private static final String KEY_SETTLE_DELAY       = "navigator.settle.delay.ms";
    private static final String KEY_RECOVERY_ATTEMPTS  = "navigator.recovery.max.attempts";
    private static final String KEY_LOCK_TIMEOUT       = "service.device.lock.timeout.ms";
    private static final String KEY_CATALOGS           = "catalog.resources";
    private static final String KEY_SERVER_PORT        = "server.port";

    // Defaults
    private static final long    DEFAULT_CACHE_TTL         = 500L;
    private static final double  DEFAULT_CONFIDENCE_FLOOR  = 0.4;
    private static final double  DEFAULT_CONFIDENT         = 0.8;
    private static final int     DEFAULT_MAX_CANDIDATES    = 3;
    private static final String  DEFAULT_SHARED_APP        = "android_system";
    private static final int     DEFAULT_MAX_ATTEMPTS      = 3;
    private static final boolean DEFAULT_VERIFY_EACH_STEP  = true;
    private static final long    DEFAULT_SETTLE_DELAY      = 500L;
    private static final int     DEFAULT_RECOVERY_ATTEMPTS = 2;
    private static final long    DEFAULT_LOCK_TIMEOUT      = 30_000L;
    private static final String  DEFAULT_CATALOGS          = "catalogs/android_system.json,catalogs/instagram.json";
    private static final int     DEFAULT_SERVER_PORT       = 8765;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code screennav.local.properties} values override {@code screennav.properties}.
     *
     * @throws NavigationException if the base screennav.properties cannot be loaded
     */
    public NavigatorConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new NavigationException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /**
     * Package-private constructor for tests; accepts an already-populated
     * {@link Properties} instance.
     */
    NavigatorConfig(Properties props) {
        this.props = props;
    }

    /** Configuration made only of defaults plus the given overrides. */
    public static NavigatorConfig of(Properties overrides) {
        Properties p = new Properties();
        p.putAll(overrides);
        return new NavigatorConfig(p);
    }

    // ── Detector ──────────────────────────────────────────────────────────

    /** How long a normalized UI dump is reused, in milliseconds (default: 500). */
    public long getCacheTtlMs() {
        return getLong(KEY_CACHE_TTL, DEFAULT_CACHE_TTL);
    }

    /** Minimum score for a signature to be accepted (default: 0.4). */
    public double getConfidenceFloor() {
        return getDouble(KEY_CONFIDENCE_FLOOR, DEFAULT_CONFIDENCE_FLOOR);
    }

    /** Score from which a detection counts as confident (default: 0.8). */
    public double getConfidentThreshold() {
        return getDouble(KEY_CONFIDENT, DEFAULT_CONFIDENT);
    }

    public int getMaxCandidates() {
        return getInt(KEY_MAX_CANDIDATES, DEFAULT_MAX_CANDIDATES);
    }

    /** App whose signatures overlay every other app (system dialogs). */
    public String getSharedAppId() {
        return props.getProperty(KEY_SHARED_APP, DEFAULT_SHARED_APP).trim();
    }

    // ── Navigator ─────────────────────────────────────────────────────────

    /** Re-plans tolerated before a navigation fails (default: 3). */
    public int getMaxAttempts() {
        return getInt(KEY_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
    }

    public boolean isVerifyEachStep() {
        return getBool(KEY_VERIFY_EACH_STEP, DEFAULT_VERIFY_EACH_STEP);
    }

    /** Pause between executing an edge and verifying the screen (default: 500). */
    public long getSettleDelayMs() {
        return getLong(KEY_SETTLE_DELAY, DEFAULT_SETTLE_DELAY);
    }

    /** Attempt budget for each target tried by safe-state recovery (default: 2). */
    public int getRecoveryMaxAttempts() {
        return getInt(KEY_RECOVERY_ATTEMPTS, DEFAULT_RECOVERY_ATTEMPTS);
    }

    // ── Service ───────────────────────────────────────────────────────────

    public long getDeviceLockTimeoutMs() {
        return getLong(KEY_LOCK_TIMEOUT, DEFAULT_LOCK_TIMEOUT);
    }

    /** Classpath catalogs loaded at startup. */
    public List<String> getCatalogResources() {
        String raw = props.getProperty(KEY_CATALOGS, DEFAULT_CATALOGS);
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public int getServerPort() {
        return getInt(KEY_SERVER_PORT, DEFAULT_SERVER_PORT);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
