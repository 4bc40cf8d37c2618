package com.herzen.assurance.domain;

import com.herzen.assurance.domain.AssuranceModels.Defeater;
import com.herzen.assurance.domain.AssuranceModels.DefeaterStatus;

import java.util.*;

public class DefeaterLedger {
    private final Map<String, Defeater> entries = new LinkedHashMap<>();

    // A re-detected defeater takes the new description and impact but keeps its recorded status.
    public Defeater record(Defeater detected) {
        return entries.merge(detected.id(), detected, (recorded, current) -> current.withStatus(recorded.status()));
    }

    public Defeater raise(Defeater manual) {
        if (entries.containsKey(manual.id())) {
            throw new IllegalArgumentException("Defeater already recorded: " + manual.id());
        }
        entries.put(manual.id(), manual);
        return manual;
    }

    public Defeater resolve(String defeaterId, DefeaterStatus status) {
        Defeater current = entries.get(defeaterId);
        if (current == null) {
            throw new NoSuchElementException("Unknown defeater: " + defeaterId);
        }
        if (status == DefeaterStatus.OPEN && current.status() != DefeaterStatus.OPEN) {
            throw new IllegalArgumentException("Resolved defeaters cannot be reopened: " + defeaterId);
        }
        Defeater updated = current.withStatus(status);
        entries.put(defeaterId, updated);
        return updated;
    }

    public Optional<Defeater> find(String defeaterId) {
        return Optional.ofNullable(entries.get(defeaterId));
    }

    public List<Defeater> forNode(String nodeId) {
        return entries.values().stream().filter(d -> nodeId.equals(d.targetNodeId())).toList();
    }

    public List<Defeater> all() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }
}
