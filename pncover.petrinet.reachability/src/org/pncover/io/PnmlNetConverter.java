package org.pncover.io;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.apache.log4j.Logger;
import org.pncover.exceptions.InputException;
import org.pncover.model.PetriNet;
import org.pncover.utils.StringFileIO;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Converts a place/transition PNML document into an engine net.
 *
 * Places and transitions are indexed in document order. Arcs from a place to
 * a transition go into I-, arcs from a transition to a place into I+; the arc
 * weight is the inscription, 1 when absent. Elements are matched by local name
 * so PNML with and without the 2009 grammar namespace both load.
 */
public class PnmlNetConverter {

    private static final Logger logger = Logger.getLogger(PnmlNetConverter.class);

    private static final String PLACES = "//*[local-name()='place']";
    private static final String TRANSITIONS = "//*[local-name()='transition']";
    private static final String ARCS = "//*[local-name()='arc']";
    private static final String MARKING_TEXT = "./*[local-name()='initialMarking']/*[local-name()='text']";
    private static final String INSCRIPTION_TEXT = "./*[local-name()='inscription']/*[local-name()='text']";

    private final XPath xpath = XPathFactory.newInstance().newXPath();

    private final Map<String, Integer> placeIndex = new LinkedHashMap<>();
    private final Map<String, Integer> transitionIndex = new LinkedHashMap<>();
    private int skippedArcs;

    public NetInput convertFile(String path) throws InputException {
        String xml;
        try {
            xml = StringFileIO.readFileAsString(path);
        } catch (IOException e) {
            throw new InputException("Cannot read PNML file " + path, e);
        }
        return convert(xml);
    }

    /**
     * @return the net with no subnet layout, so it runs as a single subnet
     */
    public NetInput convert(String pnml) throws InputException {
        placeIndex.clear();
        transitionIndex.clear();
        skippedArcs = 0;

        Document doc = parse(pnml);
        try {
            NodeList places = (NodeList) xpath.evaluate(PLACES, doc, XPathConstants.NODESET);
            int[] m0 = new int[places.getLength()];
            for (int i = 0; i < places.getLength(); i++) {
                Element place = (Element) places.item(i);
                String id = requireId(place, "place");
                if (placeIndex.put(id, i) != null) {
                    throw new InputException("Duplicate place id '" + id + "'", id);
                }
                m0[i] = readInt(xpath.evaluate(MARKING_TEXT, place), 0, "initialMarking of " + id);
            }

            NodeList transitions = (NodeList) xpath.evaluate(TRANSITIONS, doc, XPathConstants.NODESET);
            for (int i = 0; i < transitions.getLength(); i++) {
                String id = requireId((Element) transitions.item(i), "transition");
                if (placeIndex.containsKey(id) || transitionIndex.put(id, i) != null) {
                    throw new InputException("Duplicate node id '" + id + "'", id);
                }
            }

            if (placeIndex.isEmpty() || transitionIndex.isEmpty()) {
                throw new InputException("PNML must declare at least one place and one transition");
            }

            int[][] iMinus = new int[placeIndex.size()][transitionIndex.size()];
            int[][] iPlus = new int[placeIndex.size()][transitionIndex.size()];
            NodeList arcs = (NodeList) xpath.evaluate(ARCS, doc, XPathConstants.NODESET);
            for (int i = 0; i < arcs.getLength(); i++) {
                addArc((Element) arcs.item(i), iMinus, iPlus);
            }

            logger.info("Converted PNML: " + placeIndex.size() + " places, " + transitionIndex.size()
                    + " transitions, " + (arcs.getLength() - skippedArcs) + " arcs"
                    + (skippedArcs > 0 ? " (" + skippedArcs + " skipped)" : ""));
            return new NetInput(PetriNet.create(m0, iMinus, iPlus), null);
        } catch (XPathExpressionException e) {
            throw new InputException("Cannot evaluate PNML structure: " + e.getMessage(), e);
        }
    }

    private void addArc(Element arc, int[][] iMinus, int[][] iPlus) throws XPathExpressionException,
            InputException {
        String id = arc.getAttribute("id");
        String source = arc.getAttribute("source");
        String target = arc.getAttribute("target");
        int weight = readInt(xpath.evaluate(INSCRIPTION_TEXT, arc), 1, "inscription of arc " + id);
        if (weight < 0) {
            throw new InputException("Arc " + id + " has negative weight " + weight, id);
        }

        if (placeIndex.containsKey(source) && transitionIndex.containsKey(target)) {
            iMinus[placeIndex.get(source)][transitionIndex.get(target)] += weight;
        } else if (transitionIndex.containsKey(source) && placeIndex.containsKey(target)) {
            iPlus[placeIndex.get(target)][transitionIndex.get(source)] += weight;
        } else {
            skippedArcs++;
            logger.warn("Skipping arc '" + id + "' " + source + " -> " + target
                    + ": does not connect a place and a transition");
        }
    }

    private Document parse(String pnml) throws InputException {
        if (pnml == null || pnml.trim().isEmpty()) {
            throw new InputException("PNML input is empty");
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            return factory.newDocumentBuilder().parse(new InputSource(new StringReader(pnml)));
        } catch (SAXException | ParserConfigurationException | IOException e) {
            throw new InputException("PNML not well formed: " + e.getMessage(), e);
        }
    }

    private static String requireId(Element element, String kind) throws InputException {
        String id = element.getAttribute("id");
        if (id.isEmpty()) {
            throw new InputException("PNML " + kind + " without id attribute");
        }
        return id;
    }

    private static int readInt(String text, int fallback, String field) throws InputException {
        String value = text == null ? "" : text.trim();
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InputException("'" + value + "' in " + field + " is not an integer", field);
        }
    }

    /** Place ids in index order, from the last conversion. */
    public List<String> getPlaceIds() {
        return new ArrayList<>(placeIndex.keySet());
    }

    /** Transition ids in index order, from the last conversion. */
    public List<String> getTransitionIds() {
        return new ArrayList<>(transitionIndex.keySet());
    }

    public int getSkippedArcCount() {
        return skippedArcs;
    }

    /** Converts PNML straight to the engine JSON format. */
    public String toEngineJson(String pnml) throws InputException {
        return new NetInputParser().toJson(convert(pnml));
    }
}
