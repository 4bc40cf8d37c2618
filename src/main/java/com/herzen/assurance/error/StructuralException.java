package com.herzen.assurance.error;

import com.herzen.assurance.gsn.GsnModels.Violation;

import java.util.List;
import java.util.stream.Collectors;

public class StructuralException extends AssuranceException {
    private final List<Violation> violations;

    public StructuralException(List<Violation> violations) {
        super("Structural violations: " + violations.stream().map(Violation::message).collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    @Override
    public String code() {
        return violations.isEmpty() ? "STRUCTURAL" : violations.get(0).type().name();
    }
}
