package com.herzen.assurance.service;

import com.herzen.assurance.acql.AcqlModels.ScriptEntry;
import com.herzen.assurance.argtl.ArgTLModels.ScriptResult;
import com.herzen.assurance.domain.AssuranceCase;
import com.herzen.assurance.domain.AssuranceModels.ConfidenceReport;

import java.util.List;

public class CertificationModels {
    public record PatternUse(String pattern, String component, String fragmentId) {}

    public record CertificationRequest(String caseId,
                                       String title,
                                       List<PatternUse> patterns,
                                       List<String> fragmentDefinitions,
                                       String script,
                                       List<String> queries,
                                       boolean worstCase,
                                       boolean sealWhenCertified) {
        public CertificationRequest {
            patterns = patterns == null ? List.of() : List.copyOf(patterns);
            fragmentDefinitions = fragmentDefinitions == null ? List.of() : List.copyOf(fragmentDefinitions);
            queries = queries == null ? List.of() : List.copyOf(queries);
        }
    }

    public record CertificationError(String stage, String code, String message) {}

    public record CertificationResult(boolean certified,
                                      AssuranceCase assuranceCase,
                                      ScriptResult script,
                                      ConfidenceReport report,
                                      List<ScriptEntry> queries,
                                      List<CertificationError> errors) {
        public CertificationResult {
            queries = List.copyOf(queries);
            errors = List.copyOf(errors);
        }
    }
}
