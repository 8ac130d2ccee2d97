package com.al.cdanormalizer.service;

import com.al.cdanormalizer.config.PipelineProperties;
import com.al.cdanormalizer.dto.ProcessingIssue;
import com.al.cdanormalizer.dto.ProcessingRequest;
import com.al.cdanormalizer.dto.ProcessingResult;
import com.al.cdanormalizer.exception.MalformedDocumentException;
import com.al.cdanormalizer.model.ClinicalDocument;
import com.al.cdanormalizer.model.ContentKind;
import com.al.cdanormalizer.model.ErrorKind;
import com.al.cdanormalizer.model.ExtractionMethod;
import com.al.cdanormalizer.model.ProcessingState;
import com.al.cdanormalizer.model.Section;
import com.al.cdanormalizer.service.extraction.ExtractionContext;
import com.al.cdanormalizer.service.extraction.ExtractionStrategy;
import com.al.cdanormalizer.service.terminology.LanguageCodes;
import com.al.cdanormalizer.util.CdaXml;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Entry point of the pipeline: classifies the document, runs the strategy
 * chain in priority order and assembles the result.
 *
 * <p>
 * The chain stops at the first strategy whose sections hold at least one
 * entry. When none does, the sections of the last strategy that found any are
 * kept. Only a document that cannot be parsed at all fails; every other
 * problem is recorded as an issue on a successful result.
 */
@Service
@Slf4j
public class ExtractionOrchestrator {

    private final List<ExtractionStrategy> strategies;
    private final ResultAssembler resultAssembler;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ExtractionOrchestrator(List<ExtractionStrategy> strategies, ResultAssembler resultAssembler,
            PipelineProperties properties, MeterRegistry meterRegistry) {
        List<ExtractionStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparing(ExtractionStrategy::method));
        this.strategies = List.copyOf(ordered);
        this.resultAssembler = resultAssembler;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public ProcessingResult process(String content, String requestedLanguage, String countryHint) {
        return process(ProcessingRequest.builder()
                .content(content)
                .targetLanguage(requestedLanguage)
                .countryHint(countryHint)
                .build());
    }

    public ProcessingResult process(ProcessingRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        ClinicalDocument document = ClinicalDocument.of(request.getContent());
        String targetLanguage = StringUtils.defaultIfBlank(request.getTargetLanguage(),
                properties.getDefaultLanguage());
        ExtractionContext context = ExtractionContext.builder()
                .document(document)
                .targetLanguage(targetLanguage)
                .countryCode(normalizeCountry(request.getCountryHint()))
                .maxEntriesPerSection(properties.getMaxEntriesPerSection())
                .build();

        try {
            classify(context, request);
            ProcessingResult result = runChain(context);
            meterRegistry.counter("cda.pipeline.documents", "method", result.getExtractionMethod().name(),
                    "status", "success").increment();
            log.info("Processed document {} ({}): {} sections, {} entries via {}", document.getContentHash(),
                    document.getKind(), result.getSectionsCount(), result.getEntriesCount(),
                    result.getExtractionMethod());
            return result;
        } catch (MalformedDocumentException e) {
            log.error("Malformed document {}: {}", document.getContentHash(), e.getMessage());
            context.transitionTo(ProcessingState.FAILED);
            meterRegistry.counter("cda.pipeline.documents", "method", ExtractionMethod.NONE.name(),
                    "status", "error").increment();
            meterRegistry.counter("cda.pipeline.issues", "kind", ErrorKind.MALFORMED_DOCUMENT.name()).increment();
            List<ProcessingIssue> issues = new ArrayList<>(context.getIssues());
            issues.add(ProcessingIssue.fatal(ErrorKind.MALFORMED_DOCUMENT, e.getMessage()));
            return ProcessingResult.failure(e.getMessage(), issues);
        } finally {
            sample.stop(meterRegistry.timer("cda.pipeline.duration"));
        }
    }

    /**
     * Parse the content according to its kind and settle the source language and country.
     *
     * @throws MalformedDocumentException when the content is not parseable markup
     */
    private void classify(ExtractionContext context, ProcessingRequest request) {
        ClinicalDocument document = context.getDocument();
        String headerLanguage = null;
        switch (document.getKind()) {
            case STRUCTURED_MARKUP:
                Document dom = CdaXml.parse(document.getContent(), document.getContentHash());
                context.setDom(dom);
                headerLanguage = CdaXml.text(dom, "/hl7:ClinicalDocument/hl7:languageCode/@code");
                if (context.getCountryCode() == null && properties.isDetectCountry()) {
                    context.setCountryCode(detectCountry(dom, headerLanguage));
                }
                break;
            case RENDERED_MARKUP:
                context.setHtml(Jsoup.parse(document.getContent()));
                headerLanguage = StringUtils.trimToNull(context.getHtml().select("html").attr("lang"));
                break;
            default:
                throw new MalformedDocumentException(document.getContentHash(),
                        "Content is neither structured nor rendered markup");
        }
        String sourceLanguage = StringUtils.isNotBlank(request.getSourceLanguage())
                ? request.getSourceLanguage()
                : headerLanguage;
        context.setSourceLanguage(StringUtils.isNotBlank(sourceLanguage)
                ? LanguageCodes.primary(sourceLanguage)
                : properties.getDefaultLanguage());
        context.transitionTo(ProcessingState.CLASSIFIED);
        log.debug("Document {} classified as {} (source language {}, country {})", document.getContentHash(),
                document.getKind(), context.getSourceLanguage(), context.getCountryCode());
    }

    private ProcessingResult runChain(ExtractionContext context) {
        List<ExtractionMethod> attempted = new ArrayList<>();
        List<Section> fallbackSections = List.of();
        ExtractionMethod fallbackMethod = ExtractionMethod.NONE;

        for (ExtractionStrategy strategy : strategies) {
            if (!properties.isStrategyEnabled(strategy.method()) || !strategy.supports(context)) {
                continue;
            }
            context.transitionTo(ProcessingState.STRATEGY_ATTEMPTED);
            attempted.add(strategy.method());
            List<Section> sections;
            try {
                sections = strategy.tryExtract(context);
            } catch (RuntimeException e) {
                handleStrategyError(strategy.method(), e, context);
                continue;
            }
            if (hasEntries(sections)) {
                log.debug("Strategy {} produced clinical data", strategy.method());
                context.transitionTo(ProcessingState.ASSEMBLED);
                return resultAssembler.assemble(sections, strategy.method(), attempted, context);
            }
            if (!sections.isEmpty()) {
                fallbackSections = sections;
                fallbackMethod = strategy.method();
            }
        }

        if (fallbackSections.isEmpty()) {
            context.recordIssue(ErrorKind.STRATEGY_EXHAUSTED, null,
                    "No strategy found sections in the document (attempted " + attempted + ")");
            meterRegistry.counter("cda.pipeline.issues", "kind", ErrorKind.STRATEGY_EXHAUSTED.name()).increment();
        }
        context.transitionTo(ProcessingState.ASSEMBLED);
        return resultAssembler.assemble(fallbackSections, fallbackMethod, attempted, context);
    }

    private void handleStrategyError(ExtractionMethod method, RuntimeException e, ExtractionContext context) {
        log.warn("Strategy {} failed for document {}: {}", method, context.getDocument().getContentHash(),
                e.getMessage());
        context.recordIssue(ErrorKind.STRATEGY_FAILED, null, "Error in " + method + ": " + e.getMessage());
        meterRegistry.counter("cda.pipeline.issues", "kind", ErrorKind.STRATEGY_FAILED.name()).increment();
    }

    private static boolean hasEntries(List<Section> sections) {
        return sections.stream().anyMatch(section -> !section.getEntries().isEmpty());
    }

    private static String detectCountry(Document dom, String headerLanguage) {
        String realm = CdaXml.text(dom, "/hl7:ClinicalDocument/hl7:realmCode/@code");
        if (realm != null && realm.length() == 2) {
            return realm.toUpperCase(Locale.ROOT);
        }
        return LanguageCodes.region(headerLanguage);
    }

    private static String normalizeCountry(String countryHint) {
        return StringUtils.isBlank(countryHint) ? null : countryHint.trim().toUpperCase(Locale.ROOT);
    }
}
