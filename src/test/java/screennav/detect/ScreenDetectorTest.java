package screennav.detect;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import screennav.device.DeviceDriver;
import screennav.device.DriverException;
import screennav.model.ScreenDetectionResult;
import screennav.model.ScreenSignature;
import screennav.model.SignatureDump;
import screennav.model.UiNode;
import screennav.navigator.NavigatorConfig;
import screennav.signature.SignatureStore;
import screennav.testutil.MutableClock;
import screennav.testutil.Screens;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ScreenDetector}.
 *
 * <p>The device driver is mocked and time is driven by {@link MutableClock},
 * so cache expiry is deterministic.
 */
public class ScreenDetectorTest {

    @Mock DeviceDriver driver;

    private AutoCloseable mocks;
    private MutableClock clock;
    private SignatureStore store;
    private ScreenDetector detector;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(driver.getSerial()).thenReturn("emulator-5554");

        store = new SignatureStore("android_system");
        store.register("app", List.of(
                ScreenSignature.builder(null, "home").priority(50).required(":id/feed", ":id/tab_bar")
                        .optional(":id/stories").safeState(true).description("Home feed").build(),
                ScreenSignature.builder(null, "search").priority(40).required(":id/search_bar", ":id/tab_bar")
                        .forbidden(":id/feed").build(),
                ScreenSignature.builder(null, "comments").priority(95).unique(":id/comment_box")
                        .recoveryAction("back").build()));
        store.register("android_system", List.of(
                ScreenSignature.builder(null, "permission_dialog").priority(100)
                        .unique(":id/permission_message").build()));

        Properties p = new Properties();
        p.setProperty("detector.cache.ttl.ms", "500");
        clock = new MutableClock(1_000_000L);
        detector = new ScreenDetector(driver, store, NavigatorConfig.of(p), clock);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    // ── Detection ─────────────────────────────────────────────────────────

    @Test(description = "Best-scoring signature wins and carries its metadata")
    public void testDetectsBestMatch() throws Exception {
        when(driver.dumpUiTree()).thenReturn(Screens.withIds("feed", "tab_bar", "stories"));

        ScreenDetectionResult r = detector.detect("app");

        assertThat(r.getScreenId()).isEqualTo("home");
        assertThat(r.getAppId()).isEqualTo("app");
        assertThat(r.getConfidence()).isEqualTo(1.0);
        assertThat(r.isConfident()).isTrue();
        assertThat(r.isSafeState()).isTrue();
        assertThat(r.getDescription()).isEqualTo("Home feed");
        assertThat(r.getMatchedElements()).contains("required::id/feed", "optional::id/stories");
        assertThat(r.hasError()).isFalse();
    }

    @Test(description = "Runner-up signatures are reported as candidates, excluding the winner")
    public void testCandidatesExcludeWinner() throws Exception {
        when(driver.dumpUiTree()).thenReturn(Screens.withIds("search_bar", "tab_bar", "feed_hint"));
        // search: 2/2 required; home: 1/2 required (tab_bar)
        ScreenDetectionResult r = detector.detect("app");

        assertThat(r.getScreenId()).isEqualTo("search");
        assertThat(r.getCandidates()).extracting(c -> c.screenId()).containsExactly("home");
        assertThat(r.getCandidates().get(0).score()).isEqualTo(0.5);
    }

    @Test(description = "Shared overlay signatures are detected with their own app id")
    public void testSharedOverlayDetected() throws Exception {
        when(driver.dumpUiTree()).thenReturn(Screens.withIds("feed", "tab_bar", "permission_message"));

        ScreenDetectionResult r = detector.detect("app");

        assertThat(r.getFullId()).isEqualTo("android_system/permission_dialog");
    }

    @Test(description = "Below the confidence floor the screen is unknown, with the best score as confidence")
    public void testUnknownBelowFloor() throws Exception {
        store.register("app", List.of(
                ScreenSignature.builder(null, "wide").required(":id/a", ":id/b", ":id/c").build()));
        when(driver.dumpUiTree()).thenReturn(Screens.withIds("a"));

        ScreenDetectionResult r = detector.detect("app");

        assertThat(r.isUnknown()).isTrue();
        assertThat(r.getConfidence()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(r.getCandidates()).extracting(c -> c.screenId()).containsExactly("wide");
        assertThat(detector.getStats().unknownCount()).isEqualTo(1);
    }

    @Test(description = "A failed dump is reported as an error result and not counted")
    public void testDumpFailure() throws Exception {
        when(driver.dumpUiTree()).thenThrow(new DriverException("adb offline"));

        ScreenDetectionResult r = detector.detect("app");

        assertThat(r.isUnknown()).isTrue();
        assertThat(r.getError()).startsWith("Failed to dump UI hierarchy").contains("adb offline");
        assertThat(detector.getStats().detectionCount()).isZero();
    }

    @Test(description = "An app without signatures is reported as an error result")
    public void testNoSignatures() throws Exception {
        when(driver.dumpUiTree()).thenReturn(Screens.withIds("feed"));

        ScreenDetectionResult r = detector.detect("other_app");

        assertThat(r.getError()).isEqualTo("No signatures registered for app: other_app");
    }

    // ── Cache ─────────────────────────────────────────────────────────────

    @Test(description = "Dumps are reused within the TTL and refreshed after it")
    public void testCacheTtl() throws Exception {
        when(driver.dumpUiTree()).thenReturn(Screens.withIds("feed", "tab_bar"));

        detector.detect("app");
        clock.advance(499);
        detector.detect("app");
        verify(driver, times(1)).dumpUiTree();

        clock.advance(1);
        detector.detect("app");
        verify(driver, times(2)).dumpUiTree();
    }

    @Test(description = "forceRefresh bypasses a fresh cache")
    public void testForceRefresh() throws Exception {
        UiNode home = Screens.withIds("feed", "tab_bar");
        UiNode comments = Screens.withIds("comment_box");
        when(driver.dumpUiTree()).thenReturn(home, comments);

        assertThat(detector.detect("app").getScreenId()).isEqualTo("home");
        assertThat(detector.detect("app").getScreenId()).isEqualTo("home");
        assertThat(detector.detect("app", true).getScreenId()).isEqualTo("comments");
    }

    @Test(description = "invalidateCache forces the next detection to dump again")
    public void testInvalidateCache() throws Exception {
        when(driver.dumpUiTree()).thenReturn(Screens.withIds("feed", "tab_bar"));

        detector.detect("app");
        detector.invalidateCache();
        detector.detect("app");

        verify(driver, times(2)).dumpUiTree();
    }

    // ── Stats and authoring ───────────────────────────────────────────────

    @Test(description = "Stats count detections and unknown results")
    public void testStats() throws Exception {
        when(driver.dumpUiTree()).thenReturn(Screens.withIds("feed", "tab_bar"), Screens.withIds("nothing"));

        detector.detect("app", true);
        detector.detect("app", true);

        assertThat(detector.getStats().detectionCount()).isEqualTo(2);
        assertThat(detector.getStats().unknownCount()).isEqualTo(1);
        assertThat(detector.getStats().unknownRate()).isEqualTo(0.5);
    }

    @Test(description = "Signature dump groups a fresh dump by element kind")
    public void testDumpForSignature() throws Exception {
        UiNode root = Screens.withIds("feed");
        root.withChild(new UiNode(null, "Follow", "Follow user", "android.widget.Button").withClickable(true));
        when(driver.dumpUiTree()).thenReturn(root);

        SignatureDump dump = detector.dumpForSignature();

        assertThat(dump.identifiers()).containsExactly("feed");
        assertThat(dump.texts()).containsExactly("Follow");
        assertThat(dump.labels()).containsExactly("Follow user");
        assertThat(dump.classes()).containsExactly("Button", "FrameLayout", "View");
        assertThat(dump.clickables()).containsExactly("Follow user");
        assertThat(dump.timestamp().toEpochMilli()).isEqualTo(1_000_000L);
        assertThat(dump.hint()).isEqualTo(SignatureDump.HINT);
    }
}
