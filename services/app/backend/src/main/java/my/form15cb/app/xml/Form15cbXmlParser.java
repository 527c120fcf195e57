package my.form15cb.app.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a Form 15CB document back into the flat field dictionary. A field is present in the result
 * only if its element exists and carries text; values are trimmed.
 */
public class Form15cbXmlParser {
	private static final Logger logger = LoggerFactory.getLogger(Form15cbXmlParser.class);

	public Map<String, String> parse(Path path) {
		if (path == null || !Files.isRegularFile(path)) {
			throw new XmlParseException("XML document not found: " + path);
		}
		try (InputStream in = Files.newInputStream(path)) {
			Map<String, String> fields = parse(in);
			logger.info("Parsed {} fields from {}.", fields.size(), path.getFileName());
			return fields;
		} catch (IOException ex) {
			throw new XmlParseException("Failed to read XML document: " + path, ex);
		}
	}

	public Map<String, String> parse(InputStream in) {
		Document document;
		try {
			document = newDocumentBuilder().parse(in);
		} catch (SAXException ex) {
			throw new XmlParseException("Malformed XML document: " + ex.getMessage(), ex);
		} catch (IOException ex) {
			throw new XmlParseException("Failed to read XML document", ex);
		}
		return extract(document.getDocumentElement());
	}

	private Map<String, String> extract(Element root) {
		Map<String, String> fields = new LinkedHashMap<>();
		for (Form15cbTagMap.TagPath tagPath : Form15cbTagMap.paths()) {
			Element node = find(root, tagPath);
			if (node == null) {
				continue;
			}
			String text = leadingText(node);
			if (text != null) {
				fields.put(tagPath.fieldKey(), text.trim());
			}
		}
		return fields;
	}

	private static Element find(Element root, Form15cbTagMap.TagPath tagPath) {
		Element current = root;
		for (Form15cbTagMap.QualifiedName step : tagPath.steps()) {
			current = firstChild(current, step);
			if (current == null) {
				return null;
			}
		}
		return current;
	}

	private static Element firstChild(Element parent, Form15cbTagMap.QualifiedName name) {
		for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
			if (child.getNodeType() == Node.ELEMENT_NODE
					&& name.namespace().equals(child.getNamespaceURI())
					&& name.localName().equals(child.getLocalName())) {
				return (Element) child;
			}
		}
		return null;
	}

	/**
	 * Character data before the first child element, or {@code null} if there is none.
	 */
	private static String leadingText(Element element) {
		StringBuilder text = null;
		for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
			short type = child.getNodeType();
			if (type == Node.ELEMENT_NODE) {
				break;
			}
			if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
				if (text == null) {
					text = new StringBuilder();
				}
				text.append(child.getNodeValue());
			}
		}
		return text == null ? null : text.toString();
	}

	private static DocumentBuilder newDocumentBuilder() {
		try {
			DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
			factory.setNamespaceAware(true);
			factory.setValidating(false);
			factory.setXIncludeAware(false);
			factory.setExpandEntityReferences(false);

			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
			factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
			factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
			factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
			factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
			factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");

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
		} catch (ParserConfigurationException ex) {
			throw new IllegalStateException("Failed to configure XML parser", ex);
		}
	}
}
