package com.herzen.assurance.reasoning;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class AggregatorRegistry {
    public static final String CUSTOM_PREFIX = "custom:";

    private static final ConfidenceAggregator MIN = values -> Arrays.stream(values).min().orElse(0.0);
    private static final ConfidenceAggregator AVERAGE = values -> Arrays.stream(values).average().orElse(0.0);

    private final Map<String, ConfidenceAggregator> custom = new ConcurrentHashMap<>();

    public void register(String name, ConfidenceAggregator aggregator) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Aggregator name required");
        custom.put(name, aggregator);
    }

    public Optional<ConfidenceAggregator> resolve(String requestedName) {
        if (requestedName == null || requestedName.isBlank()) return Optional.empty();
        String normalized = requestedName.trim();
        if (normalized.regionMatches(true, 0, CUSTOM_PREFIX, 0, CUSTOM_PREFIX.length())) {
            return Optional.ofNullable(custom.get(normalized.substring(CUSTOM_PREFIX.length())));
        }
        return switch (normalized.toLowerCase(Locale.ROOT)) {
            case "min" -> Optional.of(MIN);
            case "average", "avg", "mean" -> Optional.of(AVERAGE);
            default -> Optional.empty();
        };
    }
}
