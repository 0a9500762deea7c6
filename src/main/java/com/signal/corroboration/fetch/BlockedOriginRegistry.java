package com.signal.corroboration.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Origins that denied access during this run. Shared by every fetcher of a run and safe for
 * concurrent use; an origin never leaves the registry once added.
 */
public class BlockedOriginRegistry {
    private static final Logger log = LoggerFactory.getLogger(BlockedOriginRegistry.class);

    private final Set<String> blocked = ConcurrentHashMap.newKeySet();

    /**
     * Marks the origin blocked.
     *
     * @return true if this call blocked the origin, false if it was already blocked
     */
    public boolean markBlocked(String origin) {
        boolean added = blocked.add(origin);
        if (added) {
            log.info("origin.blocked origin={} totalBlocked={}", origin, blocked.size());
        }
        return added;
    }

    public boolean isBlocked(String origin) {
        return blocked.contains(origin);
    }

    /**
     * Sorted copy of the blocked origins.
     */
    public Set<String> blockedOrigins() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(blocked));
    }

    public int size() {
        return blocked.size();
    }
}
