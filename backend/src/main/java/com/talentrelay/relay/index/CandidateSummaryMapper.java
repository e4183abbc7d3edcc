package com.talentrelay.relay.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.model.CandidateSummary;
import com.talentrelay.relay.util.JsonFields;
import com.talentrelay.relay.util.LinkedInKeys;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Projects raw Ashby candidate rows to {@link CandidateSummary}.
 */
@Component
public class CandidateSummaryMapper {
    private final String appBaseUrl;

    public CandidateSummaryMapper(RelayProperties properties) {
        this.appBaseUrl = properties.getAshby().getAppBaseUrl();
    }

    /**
     * Returns {@code null} for rows without an id.
     */
    public CandidateSummary toSummary(JsonNode row) {
        if (row == null || !row.isObject()) {
            return null;
        }
        String id = JsonFields.text(row, "id");
        if (id.isEmpty()) {
            return null;
        }
        Set<String> linkedInUrls = linkedInUrls(row);
        String updatedAt = JsonFields.text(row, "updatedAt");
        String createdAt = JsonFields.text(row, "createdAt");
        long updatedAtMs = JsonFields.epochMillis(updatedAt.isEmpty() ? createdAt : updatedAt);
        return new CandidateSummary(
            id,
            JsonFields.text(row, "name"),
            profileUrl(id, JsonFields.text(row, "profileUrl")),
            new ArrayList<>(linkedInUrls),
            new ArrayList<>(LinkedInKeys.keysOf(linkedInUrls)),
            updatedAtMs,
            updatedAt,
            createdAt,
            email(row)
        );
    }

    String profileUrl(String id, String raw) {
        String value = raw == null ? "" : raw.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return value;
        }
        if (!value.isEmpty()) {
            return appBaseUrl + (value.startsWith("/") ? value : "/" + value);
        }
        return appBaseUrl + "/candidates/" + id;
    }

    private Set<String> linkedInUrls(JsonNode row) {
        Set<String> urls = new LinkedHashSet<>();
        String direct = JsonFields.text(row, "linkedInUrl", "linkedinUrl");
        if (!direct.isEmpty()) {
            urls.add(direct);
        }
        JsonNode socialLinks = row.path("socialLinks");
        if (socialLinks.isArray()) {
            for (JsonNode link : socialLinks) {
                String url = JsonFields.text(link, "url");
                if (url.isEmpty()) {
                    continue;
                }
                String type = JsonFields.text(link, "type");
                if ("linkedin".equalsIgnoreCase(type) || LinkedInKeys.normalize(url) != null) {
                    urls.add(url);
                }
            }
        }
        return urls;
    }

    private String email(JsonNode row) {
        String primary = JsonFields.text(row.path("primaryEmailAddress"), "value");
        if (!primary.isEmpty()) {
            return primary;
        }
        JsonNode addresses = row.path("emailAddresses");
        if (addresses.isArray()) {
            for (JsonNode address : addresses) {
                String value = JsonFields.text(address, "value");
                if (!value.isEmpty()) {
                    return value;
                }
            }
        }
        return "";
    }
}
