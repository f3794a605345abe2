package org.pncover.engine;

/**
 * Which subnet workers receive a firing request.
 */
public enum DispatchPolicy {
    /** Every worker; non-owners echo their unchanged local marking. */
    ALL_SUBNETS,
    /** Only the workers whose subnet owns the transition. */
    OWNERS_ONLY;

    public static DispatchPolicy parse(String value) {
        for (DispatchPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown dispatch policy '" + value + "'");
    }
}
