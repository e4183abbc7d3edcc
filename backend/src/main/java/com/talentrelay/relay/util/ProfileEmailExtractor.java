package com.talentrelay.relay.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the best email on a candidate record. Upstreams disagree on the shape, so the shapes seen in
 * practice are read explicitly and tried in priority order:
 * <ol>
 *   <li>a direct field holding a string, or an object with {@code value}</li>
 *   <li>the primary-flagged entry of an email list</li>
 *   <li>the first non-empty entry across all email lists</li>
 * </ol>
 */
public final class ProfileEmailExtractor {
    private static final List<String> DIRECT_FIELDS = List.of(
        "email", "primary_email", "primaryEmail", "primaryEmailAddress", "email_address"
    );
    private static final List<String> LIST_FIELDS = List.of("emails", "email_addresses", "emailAddresses");
    private static final String[] ADDRESS_FIELDS = {"email_address", "emailAddress", "email", "value", "address"};
    private static final String[] PRIMARY_FLAGS = {"is_primary", "isPrimary", "primary"};

    private ProfileEmailExtractor() {
    }

    public static String extract(JsonNode candidate) {
        if (candidate == null || !candidate.isObject()) {
            return "";
        }
        for (String field : DIRECT_FIELDS) {
            String direct = directValue(candidate.get(field));
            if (!direct.isEmpty()) {
                return direct;
            }
        }
        List<EmailEntry> all = new ArrayList<>();
        for (String field : LIST_FIELDS) {
            all.addAll(entries(candidate.get(field)));
        }
        for (EmailEntry entry : all) {
            if (entry.primary()) {
                return entry.address();
            }
        }
        return all.isEmpty() ? "" : all.get(0).address();
    }

    static List<EmailEntry> entries(JsonNode list) {
        List<EmailEntry> entries = new ArrayList<>();
        if (list == null || !list.isArray()) {
            return entries;
        }
        for (JsonNode item : list) {
            if (item.isTextual()) {
                String address = item.asText().trim();
                if (!address.isEmpty()) {
                    entries.add(new EmailEntry(address, false));
                }
                continue;
            }
            String address = JsonFields.text(item, ADDRESS_FIELDS);
            if (address.isEmpty()) {
                continue;
            }
            entries.add(new EmailEntry(address, isPrimary(item)));
        }
        return entries;
    }

    private static String directValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return "";
        }
        if (value.isTextual()) {
            return value.asText().trim();
        }
        if (value.isObject()) {
            return JsonFields.text(value, ADDRESS_FIELDS);
        }
        return "";
    }

    private static boolean isPrimary(JsonNode item) {
        for (String flag : PRIMARY_FLAGS) {
            if (item.path(flag).asBoolean(false)) {
                return true;
            }
        }
        return false;
    }

    public record EmailEntry(String address, boolean primary) {
    }
}
