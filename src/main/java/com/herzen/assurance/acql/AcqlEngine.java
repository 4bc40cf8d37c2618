package com.herzen.assurance.acql;

import com.herzen.assurance.acql.AcqlModels.Query;
import com.herzen.assurance.acql.AcqlModels.QueryResult;
import com.herzen.assurance.acql.AcqlModels.ScriptEntry;
import com.herzen.assurance.config.AssuranceProperties;
import com.herzen.assurance.domain.AssuranceCase;
import com.herzen.assurance.domain.AssuranceModels.ConfidenceReport;
import com.herzen.assurance.error.AssuranceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class AcqlEngine {
    private static final Logger log = LoggerFactory.getLogger(AcqlEngine.class);

    private final AssuranceProperties properties;
    private final AcqlParser parser = new AcqlParser();
    private final Map<String, Query> compiled;

    public AcqlEngine(AssuranceProperties properties) {
        this.properties = properties;
        int capacity = Math.max(0, properties.getQueryCacheSize());
        this.compiled = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Query> eldest) {
                return size() > capacity;
            }
        });
    }

    // LRU of parsed queries; parse failures are not cached
    public Query parse(String query) {
        Query cached = compiled.get(query);
        if (cached != null) return cached;
        Query parsed = parser.parse(query);
        compiled.putIfAbsent(query, parsed);
        return parsed;
    }

    // Without a report the bare graph is queried.
    public QueryResult evaluate(String query, AssuranceCase assuranceCase) {
        return evaluate(query, assuranceCase, assuranceCase.lastReport().orElse(null));
    }

    public QueryResult evaluate(String query, AssuranceCase assuranceCase, ConfidenceReport report) {
        Query parsed = parse(query);
        QueryResult result = new AcqlEvaluator(assuranceCase, report, properties.getDefeatThreshold()).evaluate(parsed);
        log.debug("ACQL [{}] on {} -> {}", query, assuranceCase.id(), result.result());
        return result;
    }

    public List<ScriptEntry> runScript(String script, AssuranceCase assuranceCase) {
        List<ScriptEntry> entries = new ArrayList<>();
        for (String raw : script.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            try {
                entries.add(new ScriptEntry(line, evaluate(line, assuranceCase), null, null));
            } catch (AssuranceException e) {
                log.debug("ACQL [{}] failed: {}", line, e.getMessage());
                entries.add(new ScriptEntry(line, null, e.code(), e.getMessage()));
            }
        }
        return entries;
    }
}
