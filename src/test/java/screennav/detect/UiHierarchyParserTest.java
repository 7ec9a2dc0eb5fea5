package screennav.detect;

import org.testng.annotations.Test;
import screennav.model.Bounds;
import screennav.model.UiNode;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link UiHierarchyParser}, using a captured uiautomator dump
 * from {@code src/test/resources/dumps}.
 */
public class UiHierarchyParserTest {

    private static String resource(String name) throws Exception {
        try (InputStream is = UiHierarchyParserTest.class.getResourceAsStream(name)) {
            assertThat(is).as("test resource %s", name).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test(description = "uiautomator attributes map onto UiNode fields")
    public void testAttributeMapping() throws Exception {
        UiNode root = UiHierarchyParser.parse(resource("/dumps/instagram_explore.xml"));

        UiNode frame = root.getChildren().get(0);
        UiNode actionBar = frame.getChildren().get(0);
        UiNode search = actionBar.getChildren().get(0);

        assertThat(search.getIdentifier()).isEqualTo("com.instagram.android:id/action_bar_search_edit_text");
        assertThat(search.getText()).isEqualTo("Search");
        assertThat(search.getLabel()).isNull();
        assertThat(search.getClassName()).isEqualTo("android.widget.EditText");
        assertThat(search.isClickable()).isTrue();
        assertThat(search.getBounds().getWidth()).isEqualTo(1000);
        assertThat(search.getVisible()).isNull();
    }

    @Test(description = "Parsed dump normalizes with invisible and collapsed nodes dropped")
    public void testNormalizeParsedDump() throws Exception {
        NormalizedElementSet set = ElementNormalizer.normalize(
                UiHierarchyParser.parse(resource("/dumps/instagram_explore.xml")));

        assertThat(set.contains("id:explore_action_bar")).isTrue();
        assertThat(set.contains("label:Search and explore")).isTrue();
        assertThat(set.contains("clickable:Reel by someone")).isTrue();
        assertThat(set.contains("id:profile_tab")).as("visible-to-user=false").isFalse();
        assertThat(set.contains("id:collapsed_banner")).as("zero height").isFalse();
    }

    @Test(description = "Bounds string parses, malformed bounds become null")
    public void testParseBounds() {
        Bounds b = UiHierarchyParser.parseBounds("[10,20][110,220]");

        assertThat(b.getLeft()).isEqualTo(10);
        assertThat(b.getBottom()).isEqualTo(220);
        assertThat(UiHierarchyParser.parseBounds("10,20,110,220")).isNull();
        assertThat(UiHierarchyParser.parseBounds("")).isNull();
    }

    @Test(description = "Malformed XML raises HierarchyParseException")
    public void testMalformed() {
        assertThatThrownBy(() -> UiHierarchyParser.parse("<hierarchy><node></hierarchy>"))
                .isInstanceOf(UiHierarchyParser.HierarchyParseException.class);
        assertThatThrownBy(() -> UiHierarchyParser.parse(""))
                .isInstanceOf(UiHierarchyParser.HierarchyParseException.class);
    }

    @Test(description = "DOCTYPE declarations are refused")
    public void testDoctypeRejected() {
        String xxe = "<?xml version=\"1.0\"?><!DOCTYPE h [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                + "<hierarchy><node text=\"&x;\"/></hierarchy>";

        assertThatThrownBy(() -> UiHierarchyParser.parse(xxe))
                .isInstanceOf(UiHierarchyParser.HierarchyParseException.class);
    }
}
