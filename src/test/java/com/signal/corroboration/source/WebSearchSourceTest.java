package com.signal.corroboration.source;

import com.signal.corroboration.core.model.Confidence;
import com.signal.corroboration.core.model.EvidenceKind;
import com.signal.corroboration.core.model.Observation;
import com.signal.corroboration.fetch.FailureReason;
import com.signal.corroboration.fetch.FetchResult;
import com.signal.corroboration.fetch.FetchedDocument;
import com.signal.corroboration.fetch.Fetcher;
import com.signal.corroboration.fetch.RetrievalStrategy;
import com.signal.corroboration.rules.SubstringExclusionPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebSearchSourceTest {

    private static final String TARGET = "https://html.duckduckgo.com/html/?q=erp+go-live";

    @Mock
    private Fetcher failing;

    private final List<String> fetched = new ArrayList<>();
    private Fetcher servingFixture;

    @BeforeEach
    void setUp() {
        String html = FixtureLoader.read("search-results.html");
        servingFixture = uri -> {
            fetched.add(uri.toString());
            return FetchResult.success(new FetchedDocument(uri, uri, 200, html, RetrievalStrategy.DIRECT));
        };
    }

    private WebSearchSource.Builder pressSource(Fetcher fetcher) {
        Map<String, List<String>> regions = new LinkedHashMap<>();
        regions.put("Saudi Arabia", List.of("saudi", "riyadh"));
        regions.put("UAE", List.of("uae", "dubai"));
        return WebSearchSource.builder()
                .id("press")
                .sourceLabel("Press Release")
                .evidenceKind(EvidenceKind.ANNOUNCEMENT)
                .target(SearchTarget.of(TARGET, "GCC"))
                .fetcher(fetcher)
                .nameExtractor(PatternNameExtractor.builder()
                        .pattern("^(.+?)\\s+(?:selects|deploys|implements|goes live)")
                        .build())
                .tagExtractor(new KeywordTagExtractor(
                        Map.of("s/4hana", "SAP S/4HANA", "ariba", "SAP Ariba"), null))
                .regionInferrer(new KeywordRegionInferrer(regions))
                .requiredTerms(List.of("sap"))
                .exclusionPolicy(SubstringExclusionPolicy.createDefault());
    }

    @Test
    @DisplayName("Should turn hits with a usable name into observations")
    void testCollectsObservations() {
        List<Observation> observations = pressSource(servingFixture).build().collect();

        assertEquals(List.of("Acme Energy LLC", "Gulf Cement Company", "Harbor Bank"),
                observations.stream().map(Observation::getEntityName).toList());
        Observation acme = observations.get(0);
        assertEquals("UAE", acme.getRegion());
        assertEquals(Set.of("SAP S/4HANA"), acme.getAttributes());
        assertEquals(EvidenceKind.ANNOUNCEMENT, acme.getEvidenceKind());
        assertEquals(Confidence.MEDIUM, acme.getConfidence());
        assertEquals("Press Release", acme.getSourceLabel());
        assertEquals("https://press.example.com/2024/acme-energy", acme.getReferenceUrl());
        assertEquals("The utility completed its ERP migration across the UAE.", acme.getExcerpt());
        assertEquals(List.of(TARGET), fetched);
    }

    @Test
    @DisplayName("Should use the target region only when the text names none")
    void testDefaultRegion() {
        List<Observation> observations = pressSource(servingFixture).build().collect();

        assertEquals("Saudi Arabia", observations.get(1).getRegion());
        assertEquals("GCC", observations.get(2).getRegion());
        assertEquals("Harbor Bank implements SAP SuccessFactors", observations.get(2).getExcerpt());
    }

    @Test
    @DisplayName("Should drop hits without a region when a region is required")
    void testRequireRegion() {
        List<Observation> observations = pressSource(servingFixture)
                .targets(List.of())
                .requireRegion(true)
                .build()
                .collect();
        assertEquals(3, observations.size());

        WebSearchSource noDefault = WebSearchSource.builder()
                .id("stories")
                .evidenceKind(EvidenceKind.CASE_STUDY)
                .target(SearchTarget.of(TARGET))
                .fetcher(servingFixture)
                .nameExtractor(PatternNameExtractor.builder().pattern("^(.+?)\\s+implements").build())
                .requireRegion(true)
                .build();
        assertTrue(noDefault.collect().isEmpty());
    }

    @Test
    @DisplayName("Should skip hits not mentioning any required term")
    void testRequiredTerms() {
        WebSearchSource source = pressSource(servingFixture)
                .nameExtractor(PatternNameExtractor.builder()
                        .pattern("^(.+?)\\s+(?:outlook|goes live)")
                        .build())
                .build();

        List<Observation> observations = source.collect();

        assertEquals(1, observations.size());
        assertEquals("Acme Energy LLC", observations.get(0).getEntityName());
    }

    @Test
    @DisplayName("Should prefix excerpts and default the label to the id")
    void testExcerptPrefix() {
        WebSearchSource source = WebSearchSource.builder()
                .id("jobs")
                .evidenceKind(EvidenceKind.HIRING_SIGNAL)
                .confidence(Confidence.LOW)
                .target(SearchTarget.of(TARGET))
                .fetcher(servingFixture)
                .nameExtractor(PatternNameExtractor.builder().pattern("^(.+?)\\s+implements").build())
                .excerptPrefix("Hiring: ")
                .build();

        Observation observation = source.collect().get(0);

        assertEquals("jobs", observation.getSourceLabel());
        assertEquals("Hiring: Harbor Bank implements SAP SuccessFactors", observation.getExcerpt());
        assertEquals(Confidence.LOW, observation.getConfidence());
    }

    @Test
    @DisplayName("Should yield no observations for a target that cannot be fetched")
    void testFetchFailure() {
        when(failing.fetch(any(URI.class)))
                .thenAnswer(invocation -> FetchResult.failure(invocation.getArgument(0), FailureReason.EXHAUSTED));
        WebSearchSource source = pressSource(failing)
                .target(SearchTarget.of(TARGET + "&page=2"))
                .build();

        assertTrue(source.collect().isEmpty());
        verify(failing, times(2)).fetch(any(URI.class));
    }

    @Test
    @DisplayName("Should require the collaborators needed to collect")
    void testBuilderValidation() {
        assertThrows(NullPointerException.class, () -> WebSearchSource.builder()
                .id("x").evidenceKind(EvidenceKind.ANNOUNCEMENT).fetcher(servingFixture).build());
        assertThrows(NullPointerException.class, () -> WebSearchSource.builder()
                .evidenceKind(EvidenceKind.ANNOUNCEMENT).fetcher(servingFixture)
                .nameExtractor(text -> Optional.empty()).build());
    }
}
