package com.talentrelay.relay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentrelay.relay.http.GemApiClient;
import com.talentrelay.relay.model.SourceProfile;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.util.JsonFields;
import com.talentrelay.relay.util.LinkedInKeys;
import com.talentrelay.relay.util.ProfileEmailExtractor;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Loads the Gem candidate being uploaded and reduces it to the fields the upload needs.
 */
@Service
public class SourceProfileReader {
    private static final String LINKEDIN_PROFILE_PREFIX = "https://www.linkedin.com/in/";

    private final GemApiClient gemApiClient;

    public SourceProfileReader(GemApiClient gemApiClient) {
        this.gemApiClient = gemApiClient;
    }

    public SourceProfile load(String gemCandidateId, WriteAudit audit) {
        JsonNode candidate = gemApiClient.getCandidate(gemCandidateId, audit);
        if (candidate == null || !candidate.isObject()) {
            throw new RelayValidationException("Gem candidate " + gemCandidateId + " was not found.");
        }
        return toProfile(gemCandidateId, candidate);
    }

    static SourceProfile toProfile(String gemCandidateId, JsonNode candidate) {
        String id = JsonFields.text(candidate, "id");
        return new SourceProfile(
            id.isEmpty() ? gemCandidateId : id,
            name(candidate),
            ProfileEmailExtractor.extract(candidate),
            phone(candidate),
            linkedInUrl(candidate)
        );
    }

    private static String name(JsonNode candidate) {
        String first = JsonFields.text(candidate, "first_name", "firstName");
        String last = JsonFields.text(candidate, "last_name", "lastName");
        String joined = (first + " " + last).trim();
        return joined.isEmpty() ? JsonFields.text(candidate, "name", "nickname") : joined;
    }

    private static String phone(JsonNode candidate) {
        String direct = JsonFields.text(candidate, "phone", "phone_number", "phoneNumber");
        if (!direct.isEmpty()) {
            return direct;
        }
        for (String field : new String[] {"phone_numbers", "phoneNumbers"}) {
            JsonNode numbers = candidate.path(field);
            if (!numbers.isArray()) {
                continue;
            }
            for (JsonNode number : numbers) {
                String value = number.isTextual() ? number.asText().trim() : JsonFields.text(number, "number", "phone_number", "value");
                if (!value.isEmpty()) {
                    return value;
                }
            }
        }
        return "";
    }

    private static String linkedInUrl(JsonNode candidate) {
        String handle = JsonFields.text(candidate, "linked_in_handle", "linkedInHandle");
        if (handle.startsWith("@")) {
            handle = handle.substring(1);
        }
        if (!handle.isEmpty()) {
            return handle.toLowerCase(Locale.ROOT).contains("linkedin.com/") ? handle : LINKEDIN_PROFILE_PREFIX + handle;
        }
        JsonNode profileUrls = candidate.path("profile_urls");
        if (profileUrls.isArray()) {
            for (JsonNode url : profileUrls) {
                String value = url.isTextual() ? url.asText().trim() : JsonFields.text(url, "url");
                if (LinkedInKeys.normalize(value) != null) {
                    return value;
                }
            }
        }
        return "";
    }
}
