package com.signal.corroboration.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signal.corroboration.core.model.Confidence;
import com.signal.corroboration.core.model.EvidenceKind;
import com.signal.corroboration.fetch.Fetcher;
import com.signal.corroboration.rules.ExclusionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A validated list of {@link SourceDefinition}s loaded from JSON, able to build the
 * corresponding {@link WebSearchSource}s.
 */
public class SourceCatalog {
    private static final Logger log = LoggerFactory.getLogger(SourceCatalog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<SourceDefinition>> DEFINITION_LIST = new TypeReference<>() {};

    private final List<SourceDefinition> definitions;

    public SourceCatalog(List<SourceDefinition> definitions) {
        Set<String> ids = new HashSet<>();
        for (SourceDefinition definition : definitions) {
            validate(definition);
            if (!ids.add(definition.id())) {
                throw new CatalogLoadException("Duplicate source id '" + definition.id() + "'");
            }
        }
        this.definitions = List.copyOf(definitions);
    }

    /**
     * @throws CatalogLoadException if the stream is not a valid catalog
     */
    public static SourceCatalog load(InputStream input) {
        List<SourceDefinition> definitions;
        try {
            definitions = MAPPER.readValue(input, DEFINITION_LIST);
        } catch (JsonProcessingException e) {
            throw new CatalogLoadException("Malformed source catalog: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CatalogLoadException("Cannot read source catalog: " + e.getMessage(), e);
        }
        if (definitions == null) {
            throw new CatalogLoadException("Source catalog is empty");
        }
        SourceCatalog catalog = new SourceCatalog(definitions);
        log.info("catalog.loaded sources={}", catalog.ids());
        return catalog;
    }

    public static SourceCatalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new CatalogLoadException("Cannot read source catalog " + path + ": " + e.getMessage(), e);
        }
    }

    public List<SourceDefinition> definitions() {
        return definitions;
    }

    public List<String> ids() {
        return definitions.stream().map(SourceDefinition::id).toList();
    }

    public Optional<SourceDefinition> find(String id) {
        return definitions.stream().filter(d -> d.id().equals(id)).findFirst();
    }

    /**
     * Builds the adapter for one definition around the given fetcher.
     */
    public SourceAdapter create(SourceDefinition definition, Fetcher fetcher, ExclusionPolicy exclusionPolicy) {
        PatternNameExtractor.Builder names = PatternNameExtractor.builder()
                .patterns(definition.namePatterns())
                .exclusionPolicy(exclusionPolicy);
        if (definition.nameMinLength() != null) {
            names.minLength(definition.nameMinLength());
        }
        if (definition.nameFallbackLength() != null) {
            names.fallbackToText(definition.nameFallbackLength());
        }

        WebSearchSource.Builder builder = WebSearchSource.builder()
                .id(definition.id())
                .sourceLabel(definition.label() != null ? definition.label() : definition.id())
                .evidenceKind(EvidenceKind.fromLabel(definition.evidenceKind()))
                .confidence(definition.confidence() != null
                        ? Confidence.fromLabel(definition.confidence()) : Confidence.MEDIUM)
                .category(definition.category())
                .fetcher(fetcher)
                .parser(new SearchResultParser(selectorsOf(definition)))
                .nameExtractor(names.build())
                .tagExtractor(definition.tags().isEmpty() && definition.fallbackTag() == null
                        ? TagExtractor.NONE
                        : new KeywordTagExtractor(definition.tags(), definition.fallbackTag()))
                .regionInferrer(definition.regions().isEmpty()
                        ? RegionInferrer.NONE
                        : new KeywordRegionInferrer(definition.regions()))
                .requiredTerms(definition.requiredTerms())
                .requireRegion(definition.requireRegion())
                .exclusionPolicy(exclusionPolicy)
                .excerptPrefix(definition.excerptPrefix());
        for (SourceDefinition.TargetDefinition target : definition.targets()) {
            builder.target(new SearchTarget(URI.create(target.url()), target.region()));
        }
        return builder.build();
    }

    private static SearchResultParser.Selectors selectorsOf(SourceDefinition definition) {
        SourceDefinition.SelectorDefinition s = definition.selectors();
        if (s == null) {
            return SearchResultParser.DUCKDUCKGO;
        }
        SearchResultParser.Selectors d = SearchResultParser.DUCKDUCKGO;
        return new SearchResultParser.Selectors(
                s.item() != null ? s.item() : d.item(),
                s.title() != null ? s.title() : d.title(),
                s.link(),
                s.snippet(),
                s.maxItems() != null ? s.maxItems() : d.maxItems());
    }

    private static void validate(SourceDefinition definition) {
        if (definition.id() == null || definition.id().isBlank()) {
            throw new CatalogLoadException("Source definition without id");
        }
        String where = "source '" + definition.id() + "': ";
        if (definition.evidenceKind() == null) {
            throw new CatalogLoadException(where + "evidenceKind is required");
        }
        try {
            EvidenceKind.fromLabel(definition.evidenceKind());
            if (definition.confidence() != null) {
                Confidence.fromLabel(definition.confidence());
            }
            for (String regex : definition.namePatterns()) {
                Pattern.compile(regex);
            }
            for (SourceDefinition.TargetDefinition target : definition.targets()) {
                if (target.url() == null || URI.create(target.url()).getHost() == null) {
                    throw new CatalogLoadException(where + "target without a valid absolute url");
                }
            }
            selectorsOf(definition);
        } catch (PatternSyntaxException e) {
            throw new CatalogLoadException(where + "invalid name pattern: " + e.getDescription(), e);
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException(where + e.getMessage(), e);
        }
        if (definition.namePatterns().isEmpty() && definition.nameFallbackLength() == null) {
            throw new CatalogLoadException(where + "namePatterns or nameFallbackLength is required");
        }
    }
}
