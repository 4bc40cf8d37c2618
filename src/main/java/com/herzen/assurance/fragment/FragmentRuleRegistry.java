package com.herzen.assurance.fragment;

import com.herzen.assurance.fragment.FragmentModels.Fragment;
import com.herzen.assurance.fragment.FragmentModels.FragmentLink;
import com.herzen.assurance.fragment.FragmentModels.RuleOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class FragmentRuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(FragmentRuleRegistry.class);

    public static final String COMPLETENESS = "completeness";
    public static final String STRUCTURE = "structure";
    public static final String DEPENDENCIES = "dependencies";

    static final double MIN_DEPENDENCY_STRENGTH = 0.5;

    private final Map<String, FragmentRule> rules = Collections.synchronizedMap(new LinkedHashMap<>());

    public FragmentRuleRegistry() {
        register(COMPLETENESS, (store, fragment) -> store.missingEvidence(fragment.name()).isEmpty());
        register(STRUCTURE, (store, fragment) -> fragment.rootGoalId() != null && !fragment.graph().isEmpty());
        register(DEPENDENCIES, (store, fragment) -> {
            for (FragmentLink link : store.dependencies(fragment.name())) {
                if (!store.contains(link.target())) return false;
                if (store.assess(link.target()).strength() < MIN_DEPENDENCY_STRENGTH) return false;
            }
            return true;
        });
    }

    public void register(String name, FragmentRule rule) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Rule name required");
        rules.put(name, rule);
    }

    public List<String> ruleNames() {
        synchronized (rules) {
            return List.copyOf(rules.keySet());
        }
    }

    // An empty or null selection runs every registered rule.
    public Map<String, RuleOutcome> validate(FragmentStore store, String fragmentName, List<String> selection) {
        Fragment fragment = store.get(fragmentName);
        List<String> names = selection == null || selection.isEmpty() ? ruleNames() : selection;
        Map<String, RuleOutcome> outcomes = new LinkedHashMap<>();
        for (String name : names) {
            FragmentRule rule = rules.get(name);
            if (rule == null) {
                outcomes.put(name, RuleOutcome.UNKNOWN_RULE);
            } else {
                outcomes.put(name, rule.check(store, fragment) ? RuleOutcome.PASSED : RuleOutcome.FAILED);
            }
        }
        log.debug("Validated fragment {}: {}", fragmentName, outcomes);
        return outcomes;
    }
}
