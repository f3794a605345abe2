package org.pncover.constants;

/**
 * Shared constants for markings, node naming and graph rendering.
 *
 * OMEGA is the same sentinel the JSON input uses for a pre-declared
 * unbounded place, so markings can be read and written without translation.
 */
public class ReachabilityConstants {

    // =============================================================================
    // MARKING VALUES
    // =============================================================================
    public static final int OMEGA = -1;

    // Symbol used in labels, never the raw sentinel
    public static final String OMEGA_SYMBOL = "ω";

    // =============================================================================
    // NAMING
    // =============================================================================
    public static final String NODE_PREFIX = "m_";
    public static final String TRANSITION_PREFIX = "t";
    public static final String ROOT_NODE_NAME = NODE_PREFIX + "0";

    public static final String WORKER_THREAD_PREFIX = "subnet-worker-";

    // =============================================================================
    // SETTINGS
    // =============================================================================
    public static final String SETTINGS_RESOURCE = "reachabilitySettings.xml";
    public static final String SETTINGS_XPATH = "//EngineSettings/*";

    private ReachabilityConstants() {
    }
}
