package com.signal.corroboration.source;

import com.signal.corroboration.core.model.Confidence;
import com.signal.corroboration.core.model.EvidenceKind;
import com.signal.corroboration.core.model.Observation;
import com.signal.corroboration.fetch.FetchResult;
import com.signal.corroboration.fetch.FetchedDocument;
import com.signal.corroboration.fetch.Fetcher;
import com.signal.corroboration.rules.ExclusionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Generic adapter over listing or search pages: fetch each target, parse hits, and turn every
 * hit carrying a usable entity name into an observation.
 *
 * <p>A target that cannot be fetched contributes zero observations.</p>
 */
public class WebSearchSource implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(WebSearchSource.class);

    private final String id;
    private final String sourceLabel;
    private final EvidenceKind evidenceKind;
    private final Confidence confidence;
    private final String category;
    private final List<SearchTarget> targets;
    private final Fetcher fetcher;
    private final SearchResultParser parser;
    private final NameExtractor nameExtractor;
    private final TagExtractor tagExtractor;
    private final RegionInferrer regionInferrer;
    private final List<String> requiredTerms;
    private final boolean requireRegion;
    private final ExclusionPolicy exclusionPolicy;
    private final String excerptPrefix;

    private WebSearchSource(Builder builder) {
        this.id = builder.id;
        this.sourceLabel = builder.sourceLabel != null ? builder.sourceLabel : builder.id;
        this.evidenceKind = builder.evidenceKind;
        this.confidence = builder.confidence;
        this.category = builder.category;
        this.targets = List.copyOf(builder.targets);
        this.fetcher = builder.fetcher;
        this.parser = builder.parser;
        this.nameExtractor = builder.nameExtractor;
        this.tagExtractor = builder.tagExtractor;
        this.regionInferrer = builder.regionInferrer;
        this.requiredTerms = builder.requiredTerms.stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .toList();
        this.requireRegion = builder.requireRegion;
        this.exclusionPolicy = builder.exclusionPolicy;
        this.excerptPrefix = builder.excerptPrefix;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<Observation> collect() {
        List<Observation> observations = new ArrayList<>();
        for (SearchTarget target : targets) {
            FetchResult result = fetcher.fetch(target.uri());
            Optional<FetchedDocument> document = result.getDocument();
            if (document.isEmpty()) {
                log.debug("source.targetSkipped source={} target={} reason={}",
                        id, target.uri(), result.getFailureReason().orElse(null));
                continue;
            }
            FetchedDocument doc = document.get();
            List<SearchHit> hits = parser.parse(doc.body(), doc.retrievedUri().toString());
            int before = observations.size();
            for (SearchHit hit : hits) {
                toObservation(hit, target).ifPresent(observations::add);
            }
            log.debug("source.targetParsed source={} target={} hits={} observations={}",
                    id, target.uri(), hits.size(), observations.size() - before);
        }
        log.info("source.collected source={} targets={} observations={}", id, targets.size(), observations.size());
        return observations;
    }

    private Optional<Observation> toObservation(SearchHit hit, SearchTarget target) {
        String text = hit.combinedText();
        if (!requiredTerms.isEmpty()) {
            String lower = text.toLowerCase(Locale.ROOT);
            if (requiredTerms.stream().noneMatch(lower::contains)) {
                return Optional.empty();
            }
        }
        Optional<String> name = nameExtractor.extract(text);
        if (name.isEmpty() || exclusionPolicy.isExcluded(name.get())) {
            return Optional.empty();
        }
        String region = regionInferrer.infer(text);
        if (region.isEmpty()) {
            region = target.defaultRegion();
        }
        if (requireRegion && region.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Observation.builder()
                .entityName(name.get())
                .region(region)
                .attributes(tagExtractor.extract(text))
                .category(category)
                .evidenceKind(evidenceKind)
                .confidence(confidence)
                .sourceLabel(sourceLabel)
                .referenceUrl(hit.link())
                .excerpt(excerptPrefix + (hit.snippet().isEmpty() ? hit.title() : hit.snippet()))
                .build());
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    public EvidenceKind getEvidenceKind() {
        return evidenceKind;
    }

    public List<SearchTarget> getTargets() {
        return targets;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sourceLabel;
        private EvidenceKind evidenceKind;
        private Confidence confidence = Confidence.MEDIUM;
        private String category = "";
        private final List<SearchTarget> targets = new ArrayList<>();
        private Fetcher fetcher;
        private SearchResultParser parser = new SearchResultParser(SearchResultParser.DUCKDUCKGO);
        private NameExtractor nameExtractor;
        private TagExtractor tagExtractor = TagExtractor.NONE;
        private RegionInferrer regionInferrer = RegionInferrer.NONE;
        private final List<String> requiredTerms = new ArrayList<>();
        private boolean requireRegion;
        private ExclusionPolicy exclusionPolicy = ExclusionPolicy.NONE;
        private String excerptPrefix = "";

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceLabel(String sourceLabel) {
            this.sourceLabel = sourceLabel;
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

        public Builder category(String category) {
            this.category = category != null ? category : "";
            return this;
        }

        public Builder target(SearchTarget target) {
            this.targets.add(Objects.requireNonNull(target));
            return this;
        }

        public Builder targets(List<SearchTarget> targets) {
            targets.forEach(this::target);
            return this;
        }

        public Builder fetcher(Fetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder parser(SearchResultParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder nameExtractor(NameExtractor nameExtractor) {
            this.nameExtractor = nameExtractor;
            return this;
        }

        public Builder tagExtractor(TagExtractor tagExtractor) {
            this.tagExtractor = tagExtractor;
            return this;
        }

        public Builder regionInferrer(RegionInferrer regionInferrer) {
            this.regionInferrer = regionInferrer;
            return this;
        }

        /**
         * Hits must mention at least one of these terms (case-insensitive).
         */
        public Builder requiredTerms(List<String> terms) {
            this.requiredTerms.addAll(terms);
            return this;
        }

        /**
         * Drop hits for which neither the text nor the target yields a region.
         */
        public Builder requireRegion(boolean requireRegion) {
            this.requireRegion = requireRegion;
            return this;
        }

        public Builder exclusionPolicy(ExclusionPolicy exclusionPolicy) {
            this.exclusionPolicy = exclusionPolicy;
            return this;
        }

        public Builder excerptPrefix(String excerptPrefix) {
            this.excerptPrefix = excerptPrefix != null ? excerptPrefix : "";
            return this;
        }

        public WebSearchSource build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(evidenceKind, "evidenceKind is required");
            Objects.requireNonNull(confidence, "confidence is required");
            Objects.requireNonNull(fetcher, "fetcher is required");
            Objects.requireNonNull(parser, "parser is required");
            Objects.requireNonNull(nameExtractor, "nameExtractor is required");
            Objects.requireNonNull(tagExtractor, "tagExtractor is required");
            Objects.requireNonNull(regionInferrer, "regionInferrer is required");
            Objects.requireNonNull(exclusionPolicy, "exclusionPolicy is required");
            return new WebSearchSource(this);
        }
    }
}
