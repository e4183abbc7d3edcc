package com.talentrelay.relay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.http.AshbyRpcClient;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.util.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Finds the Ashby source used to attribute uploads. A missing source is not an error; the upload
 * simply goes out without attribution.
 */
@Service
public class SourceResolver {
    private static final Logger log = LoggerFactory.getLogger(SourceResolver.class);

    private final AshbyRpcClient rpcClient;
    private final RelayProperties.Upload settings;

    public SourceResolver(AshbyRpcClient rpcClient, RelayProperties properties) {
        this.rpcClient = rpcClient;
        this.settings = properties.getUpload();
    }

    /**
     * Returns the source id, or {@code null} when nothing matches.
     */
    public String resolveSourceId(WriteAudit audit) {
        JsonNode results = rpcClient.results("source.list", Map.of("includeArchived", false), audit);
        List<Source> sources = new ArrayList<>();
        if (results.isArray()) {
            for (JsonNode row : results) {
                String id = JsonFields.text(row, "id");
                if (id.isEmpty() || row.path("isArchived").asBoolean(false)) {
                    continue;
                }
                sources.add(new Source(id, normalize(JsonFields.text(row, "title", "name"))));
            }
        }
        Source match = pick(sources, normalize(settings.getSourcePreferredTitle()), normalize(settings.getSourceKeyword()));
        if (match == null) {
            log.info("No Ashby source matched keyword={} among {} sources", settings.getSourceKeyword(), sources.size());
            return null;
        }
        return match.id();
    }

    static Source pick(List<Source> sources, String preferredTitle, String keyword) {
        List<Predicate<String>> rules = new ArrayList<>();
        if (!preferredTitle.isEmpty()) {
            rules.add(title -> title.equals(preferredTitle));
        }
        if (!keyword.isEmpty()) {
            rules.add(title -> title.equals(keyword));
            rules.add(title -> title.contains("sourced") && title.contains(keyword));
            rules.add(title -> title.contains(keyword));
        }
        for (Predicate<String> rule : rules) {
            for (Source source : sources) {
                if (rule.test(source.title())) {
                    return source;
                }
            }
        }
        return null;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    record Source(String id, String title) {
    }
}
