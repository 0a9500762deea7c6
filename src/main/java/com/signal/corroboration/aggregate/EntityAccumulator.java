package com.signal.corroboration.aggregate;

import com.signal.corroboration.core.model.Confidence;
import com.signal.corroboration.core.model.EntityRecord;
import com.signal.corroboration.core.model.EvidenceKind;
import com.signal.corroboration.core.model.Observation;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable merge state for one canonical key. Owned by a single fold; never shared.
 */
final class EntityAccumulator {
    private final String canonicalKey;
    private final long firstSeenOrder;
    private final AggregatorOptions options;

    private String displayName = "";
    private String region = "";
    private final Set<String> attributes = new HashSet<>();
    private final Set<String> categories = new HashSet<>();
    private final Set<EvidenceKind> evidenceKinds = EnumSet.noneOf(EvidenceKind.class);
    private final List<String> sources = new ArrayList<>();
    private int observationCount;
    private Confidence bestConfidence;

    EntityAccumulator(String canonicalKey, long firstSeenOrder, AggregatorOptions options) {
        this.canonicalKey = canonicalKey;
        this.firstSeenOrder = firstSeenOrder;
        this.options = options;
    }

    void merge(Observation observation) {
        String name = observation.getEntityName().trim();
        if (name.length() > displayName.length()) {
            displayName = name;
        }

        String incomingRegion = observation.getRegion();
        if (region.isEmpty()) {
            region = incomingRegion;
        } else if (!incomingRegion.isEmpty() && options.isGenericRegion(region)) {
            region = incomingRegion;
        }

        attributes.addAll(observation.getAttributes());
        if (!observation.getCategory().isEmpty()) {
            categories.add(observation.getCategory());
        }
        evidenceKinds.add(observation.getEvidenceKind());

        String label = observation.getSourceLabel().trim();
        if (!label.isEmpty() && !sources.contains(label) && sources.size() < options.getMaxSources()) {
            sources.add(label);
        }

        observationCount++;
        bestConfidence = Confidence.max(bestConfidence, observation.getConfidence());
    }

    String getCanonicalKey() {
        return canonicalKey;
    }

    EntityRecord toRecord() {
        return new EntityRecord(canonicalKey, displayName, region, attributes, categories,
                evidenceKinds, sources, observationCount, bestConfidence, firstSeenOrder);
    }
}
