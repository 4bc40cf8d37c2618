package com.herzen.assurance.service;

import com.herzen.assurance.acql.AcqlEngine;
import com.herzen.assurance.acql.AcqlModels.ScriptEntry;
import com.herzen.assurance.argtl.ArgTLInterpreter;
import com.herzen.assurance.argtl.ArgTLModels.ParsedScript;
import com.herzen.assurance.argtl.ArgTLModels.ScriptResult;
import com.herzen.assurance.argtl.ArgTLScriptReader;
import com.herzen.assurance.domain.AssuranceCase;
import com.herzen.assurance.domain.AssuranceModels.ConfidenceReport;
import com.herzen.assurance.error.AssuranceException;
import com.herzen.assurance.fragment.FragmentDefinitionReader;
import com.herzen.assurance.fragment.FragmentModels.DefinitionResult;
import com.herzen.assurance.fragment.FragmentPatternLibrary;
import com.herzen.assurance.fragment.FragmentStore;
import com.herzen.assurance.gsn.GsnValidator;
import com.herzen.assurance.reasoning.ClarissaEngine;
import com.herzen.assurance.reasoning.EvidenceCollector;
import com.herzen.assurance.reasoning.ReasoningModels.AnalysisOptions;
import com.herzen.assurance.service.CertificationModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class CertificationService {
    private static final Logger log = LoggerFactory.getLogger(CertificationService.class);

    private final GsnValidator validator;
    private final FragmentPatternLibrary patternLibrary;
    private final FragmentDefinitionReader definitionReader;
    private final ArgTLScriptReader scriptReader;
    private final ArgTLInterpreter interpreter;
    private final ClarissaEngine engine;
    private final AcqlEngine acql;

    public CertificationService(GsnValidator validator,
                                FragmentPatternLibrary patternLibrary,
                                FragmentDefinitionReader definitionReader,
                                ArgTLScriptReader scriptReader,
                                ArgTLInterpreter interpreter,
                                ClarissaEngine engine,
                                AcqlEngine acql) {
        this.validator = validator;
        this.patternLibrary = patternLibrary;
        this.definitionReader = definitionReader;
        this.scriptReader = scriptReader;
        this.interpreter = interpreter;
        this.engine = engine;
        this.acql = acql;
    }

    public CertificationResult certify(CertificationRequest request, EvidenceCollector evidence) {
        List<CertificationError> errors = new ArrayList<>();
        AssuranceCase assuranceCase = AssuranceCase.empty(request.caseId(), request.title());

        FragmentStore store = buildStore(request, errors);
        if (!errors.isEmpty()) {
            return new CertificationResult(false, assuranceCase, null, null, List.of(), errors);
        }

        ParsedScript parsed = scriptReader.read(request.script() == null ? "[]" : request.script());
        parsed.errors().forEach(e -> errors.add(new CertificationError("script", "INVALID_SCRIPT", "step " + e.index() + ": " + e.message())));
        if (!errors.isEmpty()) {
            return new CertificationResult(false, assuranceCase, null, null, List.of(), errors);
        }
        ScriptResult script = interpreter.run(assuranceCase, parsed.operations(), store);
        if (!script.completed()) {
            var failure = script.failure();
            errors.add(new CertificationError("script", failure.errorCode(), "step " + failure.index() + ": " + failure.message()));
            return new CertificationResult(false, assuranceCase, script, null, List.of(), errors);
        }

        ConfidenceReport report;
        try {
            report = engine.analyze(assuranceCase, evidence, new AnalysisOptions(request.worstCase()));
        } catch (AssuranceException e) {
            errors.add(new CertificationError("analysis", e.code(), e.getMessage()));
            return new CertificationResult(false, assuranceCase, script, null, List.of(), errors);
        }

        List<ScriptEntry> queries = new ArrayList<>();
        for (String query : request.queries()) {
            try {
                var result = acql.evaluate(query, assuranceCase, report);
                queries.add(new ScriptEntry(query, result, null, null));
                if (!result.result()) errors.add(new CertificationError("queries", "QUERY_FAILED", query + ": " + result.message()));
            } catch (AssuranceException e) {
                queries.add(new ScriptEntry(query, null, e.code(), e.getMessage()));
                errors.add(new CertificationError("queries", e.code(), query + ": " + e.getMessage()));
            }
        }

        boolean certified = errors.isEmpty();
        if (certified && request.sealWhenCertified()) {
            interpreter.seal(assuranceCase);
        }
        log.info("Certification of {}: certified={} overall={} errors={}", assuranceCase.id(), certified, report.overallConfidence(), errors.size());
        return new CertificationResult(certified, assuranceCase, script, report, queries, errors);
    }

    private FragmentStore buildStore(CertificationRequest request, List<CertificationError> errors) {
        FragmentStore store = new FragmentStore(validator);
        for (PatternUse use : request.patterns()) {
            try {
                store.register(patternLibrary.instantiate(use.pattern(), use.component(), use.fragmentId()));
            } catch (IllegalArgumentException e) {
                errors.add(new CertificationError("fragments", "UNKNOWN_PATTERN", e.getMessage()));
            } catch (AssuranceException e) {
                errors.add(new CertificationError("fragments", e.code(), e.getMessage()));
            }
        }
        for (String definition : request.fragmentDefinitions()) {
            DefinitionResult result = definitionReader.read(definition);
            if (!result.valid()) {
                result.errors().forEach(e -> errors.add(new CertificationError("fragments", e.code(), e.path() + ": " + e.message())));
                continue;
            }
            try {
                store.register(result.fragment());
            } catch (AssuranceException e) {
                errors.add(new CertificationError("fragments", e.code(), e.getMessage()));
            }
        }
        return store;
    }
}
