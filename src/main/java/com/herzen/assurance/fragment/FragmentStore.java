package com.herzen.assurance.fragment;

import com.herzen.assurance.error.DuplicateFragmentException;
import com.herzen.assurance.error.FragmentNotFoundException;
import com.herzen.assurance.error.FragmentValidationException;
import com.herzen.assurance.error.StructuralException;
import com.herzen.assurance.fragment.FragmentModels.Fragment;
import com.herzen.assurance.fragment.FragmentModels.FragmentAssessment;
import com.herzen.assurance.fragment.FragmentModels.FragmentLink;
import com.herzen.assurance.fragment.FragmentModels.FragmentStatus;
import com.herzen.assurance.fragment.FragmentModels.FragmentType;
import com.herzen.assurance.gsn.GsnModels.GsnNode;
import com.herzen.assurance.gsn.GsnModels.NodeKind;
import com.herzen.assurance.gsn.GsnModels.Violation;
import com.herzen.assurance.gsn.GsnValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

// One per authoring session. Reads are lock-free; writes hold writeLock.
public class FragmentStore {
    private static final Logger log = LoggerFactory.getLogger(FragmentStore.class);

    public static final double VALIDATION_COMPLETENESS = 0.8;
    public static final double VALIDATION_STRENGTH = 0.7;

    private final GsnValidator validator;
    private final Map<String, Fragment> byName = new ConcurrentHashMap<>();
    private final Map<String, String> nameById = new ConcurrentHashMap<>();
    private final Map<String, FragmentStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, Map<String, FragmentLink>> dependencies = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public FragmentStore(GsnValidator validator) {
        this.validator = validator;
    }

    public void register(Fragment fragment) {
        checkStructure(fragment);
        synchronized (writeLock) {
            if (byName.containsKey(fragment.name()) || nameById.containsKey(fragment.id())) {
                throw new DuplicateFragmentException(fragment.name());
            }
            byName.put(fragment.name(), fragment);
            nameById.put(fragment.id(), fragment.name());
            statuses.put(fragment.name(), FragmentStatus.DRAFT);
        }
        log.debug("Registered fragment {} ({} nodes, ports={})", fragment.name(), fragment.graph().size(), fragment.ports());
    }

    // Overwrites a fragment of the same name; its status drops back to DRAFT, links are kept.
    public void replace(Fragment fragment) {
        checkStructure(fragment);
        synchronized (writeLock) {
            Fragment previous = byName.get(fragment.name());
            String owner = nameById.get(fragment.id());
            if (owner != null && !owner.equals(fragment.name())) {
                throw new DuplicateFragmentException(fragment.id());
            }
            if (previous != null) nameById.remove(previous.id());
            byName.put(fragment.name(), fragment);
            nameById.put(fragment.id(), fragment.name());
            statuses.put(fragment.name(), FragmentStatus.DRAFT);
        }
        log.info("Replaced fragment {}", fragment.name());
    }

    public Fragment get(String name) {
        Fragment fragment = byName.get(name);
        if (fragment == null) throw new FragmentNotFoundException(name);
        return fragment;
    }

    public Optional<Fragment> findById(String id) {
        String name = nameById.get(id);
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public List<Fragment> list(String pattern) {
        return byName.values().stream()
                .filter(f -> pattern == null || pattern.equals(f.pattern()))
                .sorted(Comparator.comparing(Fragment::name))
                .toList();
    }

    public List<Fragment> list(FragmentType type, FragmentStatus status) {
        return byName.values().stream()
                .filter(f -> type == null || type == f.type())
                .filter(f -> status == null || status == status(f.name()))
                .sorted(Comparator.comparing(Fragment::name))
                .toList();
    }

    public FragmentStatus status(String name) {
        get(name);
        return statuses.getOrDefault(name, FragmentStatus.DRAFT);
    }

    // source depends on target; the interface point names where they meet and may be null
    public FragmentLink link(String source, String target, String interfacePoint) {
        get(source);
        get(target);
        FragmentLink link = new FragmentLink(source, target, interfacePoint == null || interfacePoint.isBlank() ? null : interfacePoint);
        synchronized (writeLock) {
            dependencies.computeIfAbsent(source, k -> new LinkedHashMap<>()).put(target, link);
        }
        log.debug("Linked fragment {} -> {} at {}", source, target, link.interfacePoint());
        return link;
    }

    public List<FragmentLink> dependencies(String name) {
        synchronized (writeLock) {
            return List.copyOf(dependencies.getOrDefault(name, Map.of()).values());
        }
    }

    public List<String> dependents(String name) {
        synchronized (writeLock) {
            return dependencies.entrySet().stream()
                    .filter(e -> e.getValue().containsKey(name))
                    .map(Map.Entry::getKey)
                    .sorted()
                    .toList();
        }
    }

    // 0.3 structure + 0.5 evidence completeness + 0.2 dependencies.
    // A DRAFT fragment with nothing missing becomes COMPLETE.
    public FragmentAssessment assess(String name) {
        Fragment fragment = get(name);
        String rootId = fragment.rootGoalId();
        Set<String> evidence = new TreeSet<>();
        fragment.graph().nodesOfKind(NodeKind.SOLUTION).forEach(n -> evidence.addAll(n.evidenceRefs()));
        List<String> missing = missingEvidence(fragment);
        int total = evidence.size() + missing.size();
        double completeness = total == 0 ? 0.0 : (double) evidence.size() / total;

        List<FragmentLink> links = dependencies(name);
        boolean interfaced = links.stream().anyMatch(l -> l.interfacePoint() != null);
        List<String> weaknesses = new ArrayList<>();
        if (rootId == null) weaknesses.add("No root goal defined");
        if (fragment.graph().isEmpty()) weaknesses.add("No argument structure");
        if (!missing.isEmpty()) weaknesses.add("Missing " + missing.size() + " evidence types");
        if (!links.isEmpty() && !interfaced) weaknesses.add("Dependencies without interface points");

        double structure = rootId != null && !fragment.graph().isEmpty() ? 1.0 : 0.0;
        double dependency = links.isEmpty() || interfaced ? 1.0 : 0.5;
        double strength = structure * 0.3 + completeness * 0.5 + dependency * 0.2;

        if (missing.isEmpty() && structure == 1.0) statuses.replace(name, FragmentStatus.DRAFT, FragmentStatus.COMPLETE);
        return new FragmentAssessment(name, strength, completeness, weaknesses, status(name), evidence.size() + "/" + total);
    }

    public FragmentAssessment markValidated(String name) {
        FragmentAssessment assessment = assess(name);
        if (assessment.status() == FragmentStatus.DEPRECATED) {
            throw new FragmentValidationException(name, "Fragment is deprecated: " + name);
        }
        if (assessment.completeness() < VALIDATION_COMPLETENESS || assessment.strength() < VALIDATION_STRENGTH) {
            throw new FragmentValidationException(name, String.format(Locale.ROOT,
                    "Fragment %s does not meet validation criteria (completeness %.2f, strength %.2f)",
                    name, assessment.completeness(), assessment.strength()));
        }
        statuses.put(name, FragmentStatus.VALIDATED);
        log.info("Validated fragment {}", name);
        return new FragmentAssessment(name, assessment.strength(), assessment.completeness(), assessment.weaknesses(),
                FragmentStatus.VALIDATED, assessment.evidenceCoverage());
    }

    public void deprecate(String name) {
        get(name);
        statuses.put(name, FragmentStatus.DEPRECATED);
    }

    public List<String> missingEvidence(String name) {
        return missingEvidence(get(name));
    }

    static List<String> missingEvidence(Fragment fragment) {
        Set<String> provided = new HashSet<>();
        for (GsnNode node : fragment.graph().nodesOfKind(NodeKind.SOLUTION)) {
            if (node.meta("evidenceType") != null) provided.add(node.meta("evidenceType"));
        }
        return requiredEvidence(fragment).stream().filter(t -> !provided.contains(t)).toList();
    }

    public static List<String> requiredEvidence(Fragment fragment) {
        String rootId = fragment.rootGoalId();
        String raw = rootId == null ? null : fragment.graph().find(rootId).map(n -> n.meta("requiredEvidence")).orElse(null);
        if (raw == null || raw.isBlank()) return List.of();
        return Arrays.stream(raw.split(",")).map(String::trim).filter(t -> !t.isEmpty()).distinct().toList();
    }

    public int size() {
        return byName.size();
    }

    private void checkStructure(Fragment fragment) {
        List<Violation> violations = validator.validate(fragment.graph(), fragment.ports());
        if (!violations.isEmpty()) throw new StructuralException(violations);
    }
}
