package com.signal.corroboration.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One raw, unverified mention of an entity produced by a source adapter.
 * Immutable; the entity name is kept exactly as observed and normalized later by the aggregator.
 */
public final class Observation {

    public static final int MAX_EXCERPT_LENGTH = 200;

    private final String entityName;
    private final String region;
    private final Set<String> attributes;
    private final String category;
    private final EvidenceKind evidenceKind;
    private final Confidence confidence;
    private final String sourceLabel;
    private final String referenceUrl;
    private final String excerpt;
    private final Instant observedAt;

    private Observation(Builder builder) {
        this.entityName = builder.entityName;
        this.region = nullToEmpty(builder.region).trim();
        this.attributes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.attributes));
        this.category = nullToEmpty(builder.category).trim();
        this.evidenceKind = builder.evidenceKind;
        this.confidence = builder.confidence;
        this.sourceLabel = builder.sourceLabel;
        this.referenceUrl = nullToEmpty(builder.referenceUrl).trim();
        this.excerpt = truncate(nullToEmpty(builder.excerpt), MAX_EXCERPT_LENGTH);
        this.observedAt = builder.observedAt != null ? builder.observedAt : Instant.now();
    }

    public String getEntityName() {
        return entityName;
    }

    public String getRegion() {
        return region;
    }

    public Set<String> getAttributes() {
        return attributes;
    }

    public String getCategory() {
        return category;
    }

    public EvidenceKind getEvidenceKind() {
        return evidenceKind;
    }

    /**
     * @return the source's confidence, or {@code null} when the source did not grade it
     */
    public Confidence getConfidence() {
        return confidence;
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    public String getReferenceUrl() {
        return referenceUrl;
    }

    public String getExcerpt() {
        return excerpt;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Observation that = (Observation) o;
        return entityName.equals(that.entityName)
                && region.equals(that.region)
                && attributes.equals(that.attributes)
                && category.equals(that.category)
                && evidenceKind == that.evidenceKind
                && confidence == that.confidence
                && sourceLabel.equals(that.sourceLabel)
                && referenceUrl.equals(that.referenceUrl)
                && excerpt.equals(that.excerpt)
                && observedAt.equals(that.observedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityName, region, attributes, category, evidenceKind,
                confidence, sourceLabel, referenceUrl, excerpt, observedAt);
    }

    @Override
    public String toString() {
        return "Observation{" +
                "entityName='" + entityName + '\'' +
                ", region='" + region + '\'' +
                ", evidenceKind=" + evidenceKind +
                ", confidence=" + confidence +
                ", sourceLabel='" + sourceLabel + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityName;
        private String region;
        private final Set<String> attributes = new LinkedHashSet<>();
        private String category;
        private EvidenceKind evidenceKind;
        private Confidence confidence;
        private String sourceLabel;
        private String referenceUrl;
        private String excerpt;
        private Instant observedAt;

        public Builder entityName(String entityName) {
            this.entityName = entityName;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder attribute(String attribute) {
            if (attribute != null && !attribute.isBlank()) {
                this.attributes.add(attribute.trim());
            }
            return this;
        }

        public Builder attributes(Collection<String> attributes) {
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder evidenceKind(EvidenceKind evidenceKind) {
            this.evidenceKind = evidenceKind;
            return this;
        }

        public Builder confidence(Confidence confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder sourceLabel(String sourceLabel) {
            this.sourceLabel = sourceLabel;
            return this;
        }

        public Builder referenceUrl(String referenceUrl) {
            this.referenceUrl = referenceUrl;
            return this;
        }

        public Builder excerpt(String excerpt) {
            this.excerpt = excerpt;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Observation build() {
            Objects.requireNonNull(entityName, "entityName is required");
            Objects.requireNonNull(evidenceKind, "evidenceKind is required");
            Objects.requireNonNull(sourceLabel, "sourceLabel is required");
            return new Observation(this);
        }
    }
}
