package com.signal.corroboration.rules;

/**
 * Predicate deciding whether a name denotes a non-target entity
 * (integrator, platform vendor, reseller or generic noise).
 */
@FunctionalInterface
public interface ExclusionPolicy {

    /**
     * Returns true if the named entity must be dropped.
     */
    boolean isExcluded(String name);

    /**
     * A policy that excludes nothing.
     */
    ExclusionPolicy NONE = name -> false;
}
