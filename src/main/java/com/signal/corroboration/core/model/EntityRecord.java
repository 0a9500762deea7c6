package com.signal.corroboration.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Read-only view of all observations that share one canonical key.
 * Instances are produced by the aggregator once folding has finished.
 */
public final class EntityRecord {
    private final String canonicalKey;
    private final String displayName;
    private final String region;
    private final SortedSet<String> attributes;
    private final SortedSet<String> categories;
    private final Set<EvidenceKind> evidenceKinds;
    private final List<String> sources;
    private final int observationCount;
    private final Confidence bestConfidence;
    private final long firstSeenOrder;

    public EntityRecord(String canonicalKey,
                        String displayName,
                        String region,
                        Set<String> attributes,
                        Set<String> categories,
                        Set<EvidenceKind> evidenceKinds,
                        List<String> sources,
                        int observationCount,
                        Confidence bestConfidence,
                        long firstSeenOrder) {
        Objects.requireNonNull(canonicalKey, "canonicalKey is required");
        Objects.requireNonNull(evidenceKinds, "evidenceKinds is required");
        if (evidenceKinds.isEmpty()) {
            throw new IllegalArgumentException("evidenceKinds must not be empty");
        }
        if (observationCount < 1) {
            throw new IllegalArgumentException("observationCount must be >= 1");
        }
        this.canonicalKey = canonicalKey;
        this.displayName = displayName != null ? displayName : canonicalKey;
        this.region = region != null ? region : "";
        this.attributes = Collections.unmodifiableSortedSet(new TreeSet<>(attributes));
        this.categories = Collections.unmodifiableSortedSet(new TreeSet<>(categories));
        this.evidenceKinds = Collections.unmodifiableSet(EnumSet.copyOf(evidenceKinds));
        this.sources = List.copyOf(sources);
        this.observationCount = observationCount;
        this.bestConfidence = bestConfidence;
        this.firstSeenOrder = firstSeenOrder;
    }

    public String getCanonicalKey() {
        return canonicalKey;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getRegion() {
        return region;
    }

    public SortedSet<String> getAttributes() {
        return attributes;
    }

    public SortedSet<String> getCategories() {
        return categories;
    }

    public Set<EvidenceKind> getEvidenceKinds() {
        return evidenceKinds;
    }

    public List<String> getSources() {
        return sources;
    }

    public int getObservationCount() {
        return observationCount;
    }

    /**
     * Highest confidence seen, or {@code null} if none was ranked.
     */
    public Confidence getBestConfidence() {
        return bestConfidence;
    }

    /**
     * Number of distinct evidence kinds backing this entity.
     */
    public int getCorroborationScore() {
        return evidenceKinds.size();
    }

    public long getFirstSeenOrder() {
        return firstSeenOrder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityRecord that = (EntityRecord) o;
        return Objects.equals(canonicalKey, that.canonicalKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonicalKey);
    }

    @Override
    public String toString() {
        return "EntityRecord{" +
                "canonicalKey='" + canonicalKey + '\'' +
                ", displayName='" + displayName + '\'' +
                ", region='" + region + '\'' +
                ", score=" + getCorroborationScore() +
                ", observations=" + observationCount +
                ", bestConfidence=" + bestConfidence +
                '}';
    }
}
