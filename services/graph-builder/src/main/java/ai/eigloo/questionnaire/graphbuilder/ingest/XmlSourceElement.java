package ai.eigloo.questionnaire.graphbuilder.ingest;

import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SourceElement} copied out of a DOM element. The whole subtree is copied when the
 * element is created, so the DOM can be discarded afterwards.
 */
final class XmlSourceElement implements SourceElement {

    static final String GEOMETRY_TAG = "mxGeometry";

    private final String tag;
    private final Map<String, String> attributes;
    private final Map<String, String> geometryAttributes;
    private final XmlSourceElement parent;
    private final List<SourceElement> children;

    private XmlSourceElement(Element element, XmlSourceElement parent) {
        this.tag = element.getTagName();
        this.attributes = attributesOf(element);
        this.parent = parent;

        Map<String, String> geometry = Map.of();
        List<SourceElement> kids = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node child = nodes.item(i);
            if (child.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element childElement = (Element) child;
            if (GEOMETRY_TAG.equals(childElement.getTagName())) {
                geometry = attributesOf(childElement);
            } else {
                kids.add(new XmlSourceElement(childElement, this));
            }
        }
        this.geometryAttributes = geometry;
        this.children = Collections.unmodifiableList(kids);
    }

    static XmlSourceElement root(Element element) {
        return new XmlSourceElement(element, null);
    }

    @Override
    public String id() {
        return attributes.get("id");
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public Map<String, String> attributes() {
        return attributes;
    }

    @Override
    public Map<String, String> geometryAttributes() {
        return geometryAttributes;
    }

    @Override
    public Optional<SourceElement> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public List<SourceElement> children() {
        return children;
    }

    @Override
    public String toString() {
        return "<" + tag + " id=" + id() + ">";
    }

    private static Map<String, String> attributesOf(Element element) {
        NamedNodeMap attrs = element.getAttributes();
        LinkedHashMap<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            values.put(attr.getNodeName(), attr.getNodeValue());
        }
        return Collections.unmodifiableMap(values);
    }
}
