package org.pncover.engine;

import java.io.IOException;
import java.util.TreeMap;

import javax.xml.xpath.XPathExpressionException;

import org.apache.log4j.Logger;
import org.pncover.constants.ReachabilityConstants;
import org.pncover.exceptions.InputException;
import org.pncover.graph.DotGraphWriter;
import org.pncover.utils.StringFileIO;
import org.pncover.utils.XPathHelperCommon;

/**
 * Engine settings, read from the {@code <EngineSettings>} block of
 * reachabilitySettings.xml:
 *
 * <pre>
 * &lt;ReachabilitySettings&gt;
 *   &lt;EngineSettings&gt;
 *     &lt;dispatchPolicy&gt;ALL_SUBNETS&lt;/dispatchPolicy&gt;
 *     &lt;omegaSymbol&gt;ω&lt;/omegaSymbol&gt;
 *     &lt;nodePrefix&gt;m_&lt;/nodePrefix&gt;
 *     &lt;transitionPrefix&gt;t&lt;/transitionPrefix&gt;
 *     &lt;includeRevisitEdges&gt;true&lt;/includeRevisitEdges&gt;
 *     &lt;recordEventHistory&gt;false&lt;/recordEventHistory&gt;
 *   &lt;/EngineSettings&gt;
 * &lt;/ReachabilitySettings&gt;
 * </pre>
 *
 * Keys that are absent keep their default.
 */
public final class EngineSettings {

    private static final Logger logger = Logger.getLogger(EngineSettings.class);

    private final DispatchPolicy dispatchPolicy;
    private final String omegaSymbol;
    private final String nodePrefix;
    private final String transitionPrefix;
    private final boolean includeRevisitEdges;
    private final boolean recordEventHistory;

    private EngineSettings(DispatchPolicy dispatchPolicy, String omegaSymbol, String nodePrefix,
            String transitionPrefix, boolean includeRevisitEdges, boolean recordEventHistory) {
        this.dispatchPolicy = dispatchPolicy;
        this.omegaSymbol = omegaSymbol;
        this.nodePrefix = nodePrefix;
        this.transitionPrefix = transitionPrefix;
        this.includeRevisitEdges = includeRevisitEdges;
        this.recordEventHistory = recordEventHistory;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DispatchPolicy.ALL_SUBNETS, ReachabilityConstants.OMEGA_SYMBOL,
                ReachabilityConstants.NODE_PREFIX, ReachabilityConstants.TRANSITION_PREFIX, true, false);
    }

    /**
     * Settings from reachabilitySettings.xml on the classpath, or the defaults
     * when the resource is missing.
     */
    public static EngineSettings load() throws InputException {
        String xml;
        try {
            xml = StringFileIO.readResourceAsString(ReachabilityConstants.SETTINGS_RESOURCE);
        } catch (IOException e) {
            throw new InputException("Cannot read " + ReachabilityConstants.SETTINGS_RESOURCE, e);
        }
        if (xml == null) {
            logger.info("No " + ReachabilityConstants.SETTINGS_RESOURCE + " on classpath, using defaults");
            return defaults();
        }
        return fromXml(xml);
    }

    public static EngineSettings loadFile(String path) throws InputException {
        try {
            return fromXml(StringFileIO.readFileAsString(path));
        } catch (IOException e) {
            throw new InputException("Cannot read settings file " + path, e);
        }
    }

    public static EngineSettings fromXml(String xml) throws InputException {
        TreeMap<String, String> settingsMap;
        try {
            settingsMap = new XPathHelperCommon().findMultipleXMLItems(xml, ReachabilityConstants.SETTINGS_XPATH);
        } catch (XPathExpressionException | IOException e) {
            throw new InputException("Settings are not well formed: " + e.getMessage(), e);
        }

        EngineSettings base = defaults();
        DispatchPolicy policy = base.dispatchPolicy;
        if (settingsMap.containsKey("dispatchPolicy")) {
            try {
                policy = DispatchPolicy.parse(settingsMap.get("dispatchPolicy"));
            } catch (IllegalArgumentException e) {
                throw new InputException(e.getMessage(), "dispatchPolicy");
            }
        }

        EngineSettings settings = new EngineSettings(policy,
                nonEmpty(settingsMap, "omegaSymbol", base.omegaSymbol),
                nonEmpty(settingsMap, "nodePrefix", base.nodePrefix),
                nonEmpty(settingsMap, "transitionPrefix", base.transitionPrefix),
                flag(settingsMap, "includeRevisitEdges", base.includeRevisitEdges),
                flag(settingsMap, "recordEventHistory", base.recordEventHistory));
        logger.info("Engine settings: " + settings);
        return settings;
    }

    private static String nonEmpty(TreeMap<String, String> settingsMap, String key, String fallback) {
        String value = settingsMap.get(key);
        return value == null || value.isEmpty() ? fallback : value;
    }

    private static boolean flag(TreeMap<String, String> settingsMap, String key, boolean fallback)
            throws InputException {
        String value = settingsMap.get(key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        throw new InputException("Setting '" + key + "' must be true or false, got '" + value + "'", key);
    }

    public EngineSettings withDispatchPolicy(DispatchPolicy policy) {
        return new EngineSettings(policy, omegaSymbol, nodePrefix, transitionPrefix, includeRevisitEdges,
                recordEventHistory);
    }

    public EngineSettings withEventHistory(boolean record) {
        return new EngineSettings(dispatchPolicy, omegaSymbol, nodePrefix, transitionPrefix, includeRevisitEdges,
                record);
    }

    public DotGraphWriter newDotWriter() {
        return new DotGraphWriter(omegaSymbol, transitionPrefix, includeRevisitEdges);
    }

    public DispatchPolicy getDispatchPolicy() {
        return dispatchPolicy;
    }

    public String getOmegaSymbol() {
        return omegaSymbol;
    }

    public String getNodePrefix() {
        return nodePrefix;
    }

    public String getTransitionPrefix() {
        return transitionPrefix;
    }

    public boolean isIncludeRevisitEdges() {
        return includeRevisitEdges;
    }

    public boolean isRecordEventHistory() {
        return recordEventHistory;
    }

    @Override
    public String toString() {
        return String.format("EngineSettings{dispatchPolicy=%s, omegaSymbol=%s, nodePrefix=%s, transitionPrefix=%s, "
                + "includeRevisitEdges=%b, recordEventHistory=%b}", dispatchPolicy, omegaSymbol, nodePrefix,
                transitionPrefix, includeRevisitEdges, recordEventHistory);
    }
}
