package com.al.cdanormalizer.service.terminology;

import com.al.cdanormalizer.PipelineFixtures;
import com.al.cdanormalizer.model.ValueSetConcept;
import com.al.cdanormalizer.util.CodeSystems;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class TerminologyResolverTest {

    @Mock
    private TerminologyCatalogue catalogue;

    private SimpleMeterRegistry meterRegistry;
    private TerminologyResolver resolver;

    private final ValueSetConcept penicillin = ValueSetConcept.builder()
            .code("764146007")
            .codeSystem(CodeSystems.SNOMED_CT)
            .display("Penicillin")
            .build();

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        resolver = new TerminologyResolver(catalogue, meterRegistry);
    }

    @Test
    public void testResolve_CodeAndSystem() {
        when(catalogue.lookupConcept("764146007", CodeSystems.SNOMED_CT)).thenReturn(Optional.of(penicillin));

        ResolvedTerm term = resolver.resolveTerm("764146007", CodeSystems.SNOMED_CT, "PCN", null);

        assertEquals("Penicillin", term.getDisplay());
        assertEquals(ResolvedTerm.Source.CATALOGUE, term.getSource());
        verify(catalogue, never()).lookupConceptByDisplay(anyString());
    }

    @Test
    public void testResolve_TranslationPreferred() {
        when(catalogue.lookupConcept("764146007", CodeSystems.SNOMED_CT)).thenReturn(Optional.of(penicillin));
        when(catalogue.lookupTranslation(penicillin, "pt")).thenReturn(Optional.of("Penicilina"));

        ResolvedTerm term = resolver.resolveTerm("764146007", CodeSystems.SNOMED_CT, null, "pt");

        assertEquals("Penicilina", term.getDisplay());
        assertEquals(ResolvedTerm.Source.CATALOGUE_TRANSLATION, term.getSource());
    }

    @Test
    public void testResolve_CodeOnlyWhenSystemMisses() {
        when(catalogue.lookupConceptByCode("764146007")).thenReturn(Optional.of(penicillin));

        assertEquals("Penicillin", resolver.resolve("764146007", "1.2.3.4", null));
    }

    @Test
    public void testResolve_DisplayMatch() {
        ValueSetConcept fever = ValueSetConcept.builder().code("386661006").display("Fever").build();
        when(catalogue.lookupConceptByDisplay("Febre")).thenReturn(Optional.of(fever));

        ResolvedTerm term = resolver.resolveTerm(null, null, "Febre", "en");

        assertEquals("Fever", term.getDisplay());
        assertEquals(ResolvedTerm.Source.DISPLAY_MATCH, term.getSource());
    }

    @Test
    public void testResolve_UncodedTextNeverSubstringMatched() {
        ResolvedTerm term = resolver.resolveTerm(null, null, "PCN", null);

        assertEquals("PCN", term.getDisplay());
        assertEquals(ResolvedTerm.Source.RAW_DISPLAY, term.getSource());
        verify(catalogue, never()).searchConceptByDisplay(any(), any());
    }

    @Test
    public void testResolve_ContainsMatchPicksConceptOfSameCode() {
        ValueSetConcept localPenicillin = ValueSetConcept.builder()
                .code("764146007").codeSystem("urn:local").display("Benzylpenicillin").build();
        when(catalogue.lookupConcept("764146007", "1.2.3.4")).thenReturn(Optional.empty());
        when(catalogue.searchConceptByDisplay("764146007", "penicillin")).thenReturn(Optional.of(localPenicillin));

        ResolvedTerm term = resolver.resolveTerm("764146007", "1.2.3.4", "penicillin", "en");

        assertEquals("Benzylpenicillin", term.getDisplay());
        verify(catalogue, never()).lookupConceptByCode(anyString());
    }

    @Test
    public void testResolve_RawTextKeptWhenOnlyLongerDisplaysContainIt() {
        TerminologyResolver seeded = new TerminologyResolver(new PipelineFixtures().catalogue, meterRegistry);

        assertEquals("Diabetes", seeded.resolve("E10", "2.16.840.1.113883.6.3", "Diabetes", "en"));
        assertEquals("Drug", seeded.resolve("X9", null, "Drug", "en"));
        assertEquals(ResolvedTerm.Source.RAW_DISPLAY,
                seeded.resolveTerm(null, null, "Allergy", "en").getSource());
    }

    @Test
    public void testResolve_ExactDisplayTranslated() {
        TerminologyResolver seeded = new TerminologyResolver(new PipelineFixtures().catalogue, meterRegistry);

        ResolvedTerm term = seeded.resolveTerm(null, null, "diabetes mellitus type 2", "pt");

        assertEquals("Diabetes mellitus tipo 2", term.getDisplay());
        assertEquals(ResolvedTerm.Source.DISPLAY_MATCH, term.getSource());
    }

    @Test
    public void testResolve_FallbackTable() {
        ResolvedTerm term = resolver.resolveTerm("20053000", CodeSystems.EDQM, null, "en");

        assertEquals("Oral use", term.getDisplay());
        assertEquals(ResolvedTerm.Source.FALLBACK_TABLE, term.getSource());
    }

    @Test
    public void testResolve_CatalogueFailureFallsBackToRaw() {
        when(catalogue.lookupConcept(anyString(), anyString())).thenThrow(new IllegalStateException("down"));

        String display = resolver.resolve("123456", CodeSystems.SNOMED_CT, "Local allergen");

        assertEquals("Local allergen", display);
        assertEquals(1.0, meterRegistry.counter("cda.terminology.errors").count());
        assertEquals(1.0, meterRegistry.counter("cda.pipeline.issues", "kind", "TERMINOLOGY_MISS").count());
    }

    @Test
    public void testResolve_CodeWhenNothingElse() {
        assertEquals("ZZ-1", resolver.resolve("ZZ-1", null, null));
        assertEquals("", resolver.resolve(null, null, "  "));
    }
}
