package ai.eigloo.questionnaire.graphbuilder.ingest;

import ai.eigloo.questionnaire.diagram.exception.DiagramParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.Set;

/**
 * Reads uncompressed draw.io documents ({@code mxfile} or bare {@code mxGraphModel}) into a
 * {@link SourceTree}.
 *
 * <p>DOCTYPE declarations and external entities are refused. A {@code diagram} page that holds
 * a compressed payload instead of an {@code mxGraphModel} is reported as a parse failure.</p>
 */
public class DrawIoXmlReader {

    private static final Logger logger = LoggerFactory.getLogger(DrawIoXmlReader.class);

    private static final Set<String> ROOT_TAGS = Set.of("mxfile", "mxGraphModel");

    public SourceTree read(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new DiagramParsingException("Diagram source is empty");
        }
        return read(new InputSource(new StringReader(xml)));
    }

    public SourceTree read(InputStream in) {
        if (in == null) {
            throw new DiagramParsingException("Diagram source stream is null");
        }
        return read(new InputSource(in));
    }

    private SourceTree read(InputSource source) {
        Document document;
        try {
            document = newDocumentBuilder().parse(source);
        } catch (SAXException | IOException e) {
            throw new DiagramParsingException("Failed to parse diagram XML: " + e.getMessage(), e);
        }

        Element root = document.getDocumentElement();
        if (!ROOT_TAGS.contains(root.getTagName())) {
            throw new DiagramParsingException("Unexpected root element <" + root.getTagName()
                    + ">, expected <mxfile> or <mxGraphModel>");
        }
        rejectCompressedPages(root);

        SourceTree tree = new SourceTree(XmlSourceElement.root(root));
        logger.debug("Read diagram source with {} elements", tree.elements().size());
        return tree;
    }

    private static void rejectCompressedPages(Element root) {
        NodeList pages = root.getElementsByTagName("diagram");
        for (int i = 0; i < pages.getLength(); i++) {
            Element page = (Element) pages.item(i);
            if (!hasChildElement(page, "mxGraphModel") && !page.getTextContent().isBlank()) {
                throw new DiagramParsingException("Diagram page '" + page.getAttribute("id")
                        + "' is compressed; export the diagram as uncompressed XML");
            }
        }
    }

    private static boolean hasChildElement(Element element, String tag) {
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && tag.equals(((Element) child).getTagName())) {
                return true;
            }
        }
        return false;
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setValidating(false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    logger.debug("XML parser warning: {}", exception.getMessage());
                }

                @Override
                public void error(SAXParseException exception) throws SAXException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXException {
                    throw exception;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }
}
