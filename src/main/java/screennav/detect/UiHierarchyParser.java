package screennav.detect;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import screennav.model.Bounds;
import screennav.model.UiNode;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a uiautomator XML dump ({@code <hierarchy><node .../></hierarchy>})
 * into a {@link UiNode} tree.
 *
 * <p>Attribute mapping: {@code resource-id} to identifier, {@code content-desc}
 * to label, {@code class}, {@code text}, {@code clickable},
 * {@code visible-to-user} and {@code bounds="[l,t][r,b]"}.
 */
public final class UiHierarchyParser {

    private static final Pattern BOUNDS = Pattern.compile("\\[(-?\\d+),(-?\\d+)]\\[(-?\\d+),(-?\\d+)]");

    private UiHierarchyParser() {}

    public static UiNode parse(String xml) throws HierarchyParseException {
        if (xml == null || xml.isBlank()) {
            throw new HierarchyParseException("Empty hierarchy dump", null);
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document doc = builder.parse(new InputSource(new StringReader(xml)));
            return toNode(doc.getDocumentElement());
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new HierarchyParseException("Malformed hierarchy dump: " + e.getMessage(), e);
        }
    }

    private static UiNode toNode(Element el) {
        UiNode node = new UiNode(
                attr(el, "resource-id"),
                attr(el, "text"),
                attr(el, "content-desc"),
                attr(el, "class"));
        node.setClickable("true".equals(el.getAttribute("clickable")));
        String visible = el.getAttribute("visible-to-user");
        if (!visible.isEmpty()) {
            node.setVisible(Boolean.parseBoolean(visible));
        }
        node.setBounds(parseBounds(el.getAttribute("bounds")));

        NodeList children = el.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                node.withChild(toNode((Element) child));
            }
        }
        return node;
    }

    /** Parses {@code [l,t][r,b]}; returns null when absent or malformed. */
    static Bounds parseBounds(String raw) {
        if (raw == null || raw.isEmpty()) return null;
        Matcher m = BOUNDS.matcher(raw);
        if (!m.matches()) return null;
        return new Bounds(
                Integer.parseInt(m.group(1)),
                Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)),
                Integer.parseInt(m.group(4)));
    }

    private static String attr(Element el, String name) {
        String v = el.getAttribute(name);
        return v.isEmpty() ? null : v;
    }

    /** The dump is not well-formed XML. */
    public static class HierarchyParseException extends Exception {
        public HierarchyParseException(String msg, Throwable cause) {
            super(msg, cause);
        }
    }
}
