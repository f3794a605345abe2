package org.pncover.utils;

import java.io.IOException;
import java.io.StringReader;
import java.util.TreeMap;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

public class XPathHelperCommon {

	/**
	 * Returns element name to trimmed text content for every element node the
	 * expression selects, e.g. {@code //EngineSettings/*} for a flat settings block.
	 */
	public TreeMap<String, String> findMultipleXMLItems(String payLoad, String itemPath)
			throws XPathExpressionException, IOException {
		TreeMap<String, String> items = new TreeMap<String, String>();
		Document xmldoc = parseXmlString(payLoad, false);

		XPath xpath = XPathFactory.newInstance().newXPath();
		NodeList nodes = (NodeList) xpath.evaluate(itemPath, xmldoc, XPathConstants.NODESET);

		for (int idx = 0; idx < nodes.getLength(); idx++) {
			Node node = nodes.item(idx);
			if (node.getNodeType() == Node.ELEMENT_NODE) {
				items.put(node.getNodeName(), node.getTextContent().trim());
			}
		}
		return items;
	}

	public Document parseXmlString(String xmlString, boolean validating) throws IOException {
		try {
			DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
			factory.setValidating(validating);
			return factory.newDocumentBuilder().parse(new InputSource(new StringReader(xmlString)));
		} catch (SAXException | ParserConfigurationException e) {
			throw new IOException("XML not well formed: " + e.getMessage(), e);
		}
	}

}
