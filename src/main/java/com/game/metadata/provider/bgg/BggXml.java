package com.game.metadata.provider.bgg;

import com.game.metadata.provider.MetadataProviderException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM helpers for the BoardGameGeek XML API. Document type declarations and external
 * entities are refused.
 */
final class BggXml {

    private BggXml() {
        // Utility class
    }

    static Document parse(String providerId, String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new MetadataProviderException(providerId, "Malformed XML payload: " + e.getMessage(), e);
        }
    }

    static List<Element> children(Element parent, String tagName) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tagName.equals(node.getNodeName())) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    static Element firstChild(Element parent, String tagName) {
        List<Element> elements = children(parent, tagName);
        return elements.isEmpty() ? null : elements.get(0);
    }

    static Element firstDescendant(Element parent, String tagName) {
        NodeList nodes = parent.getElementsByTagName(tagName);
        return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
    }

    /**
     * The {@code value} attribute of the first child named {@code tagName}, or null.
     */
    static String childValue(Element parent, String tagName) {
        Element child = firstChild(parent, tagName);
        if (child == null || !child.hasAttribute("value")) {
            return null;
        }
        String value = child.getAttribute("value").trim();
        return value.isEmpty() ? null : value;
    }

    static String childText(Element parent, String tagName) {
        Element child = firstChild(parent, tagName);
        if (child == null) {
            return null;
        }
        String text = child.getTextContent().trim();
        return text.isEmpty() ? null : text;
    }
}
