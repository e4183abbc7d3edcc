package com.talentrelay.relay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.http.AshbyRpcClient;
import com.talentrelay.relay.model.AshbyUser;
import com.talentrelay.relay.model.CreditedUserResolution;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.util.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides which Ashby user gets sourcing credit. Ambiguous matches resolve to nobody rather than to a guess.
 */
@Service
public class CreditedUserResolver {
    private static final Logger log = LoggerFactory.getLogger(CreditedUserResolver.class);
    private static final int USER_LIST_MAX_PAGES = 50;
    private static final Set<String> IGNORED_TITLE_TOKENS = Set.of("api", "key");

    public static final String STRATEGY_CONFIGURED_ID = "configured_id";
    public static final String STRATEGY_CACHE = "cache";
    public static final String STRATEGY_CONFIGURED_EMAIL = "configured_email";
    public static final String STRATEGY_API_KEY_TITLE = "api_key_title";

    private final AshbyRpcClient rpcClient;
    private final RelayProperties.Upload settings;
    private final Clock clock;
    private final AtomicReference<CachedResolution> cache = new AtomicReference<>();

    public CreditedUserResolver(AshbyRpcClient rpcClient, RelayProperties properties, Clock clock) {
        this.rpcClient = rpcClient;
        this.settings = properties.getUpload();
        this.clock = clock;
    }

    public CreditedUserResolution resolve(WriteAudit audit) {
        if (!settings.getCreditedToUserId().isEmpty()) {
            return new CreditedUserResolution(settings.getCreditedToUserId(), STRATEGY_CONFIGURED_ID);
        }
        CachedResolution cached = cache.get();
        if (cached != null && clock.millis() < cached.expiresAtMs()) {
            return new CreditedUserResolution(cached.userId(), STRATEGY_CACHE);
        }

        List<AshbyUser> enabledUsers = listEnabledUsers(audit);
        String email = settings.getCreditedToUserEmail();
        if (!email.isEmpty()) {
            for (AshbyUser user : enabledUsers) {
                if (email.equalsIgnoreCase(user.email())) {
                    return remember(new CreditedUserResolution(user.id(), STRATEGY_CONFIGURED_EMAIL));
                }
            }
        }

        JsonNode apiKey = rpcClient.results("apiKey.info", Map.of(), audit);
        String title = JsonFields.text(apiKey, "title", "name");
        String userId = bestMatchByTitle(title, enabledUsers);
        if (userId == null) {
            log.info("Credited-to user unresolved: apiKeyTitle='{}' enabledUsers={}", title, enabledUsers.size());
            return CreditedUserResolution.unresolved();
        }
        return remember(new CreditedUserResolution(userId, STRATEGY_API_KEY_TITLE));
    }

    /**
     * Returns the unique best-scoring user id, or {@code null} on a tie or when nobody scores.
     */
    static String bestMatchByTitle(String title, List<AshbyUser> users) {
        List<String> titleTokens = new ArrayList<>();
        for (String token : tokenize(title)) {
            if (token.length() >= 2 && !IGNORED_TITLE_TOKENS.contains(token)) {
                titleTokens.add(token);
            }
        }
        if (titleTokens.isEmpty()) {
            return null;
        }
        String bestId = null;
        int bestScore = 0;
        boolean tied = false;
        for (AshbyUser user : users) {
            int score = score(titleTokens, userTokens(user));
            if (score > bestScore) {
                bestScore = score;
                bestId = user.id();
                tied = false;
            } else if (score == bestScore && score > 0) {
                tied = true;
            }
        }
        return bestScore > 0 && !tied ? bestId : null;
    }

    static int score(List<String> titleTokens, Set<String> userTokens) {
        int total = 0;
        for (String titleToken : titleTokens) {
            int best = 0;
            for (String userToken : userTokens) {
                if (titleToken.equals(userToken)) {
                    best = Math.max(best, titleToken.length() >= 4 ? 3 : 2);
                } else if (titleToken.startsWith(userToken) || userToken.startsWith(titleToken)) {
                    best = Math.max(best, 1);
                }
            }
            total += best;
        }
        return total;
    }

    static List<String> tokenize(String value) {
        List<String> tokens = new ArrayList<>();
        if (value == null) {
            return tokens;
        }
        for (String token : value.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static Set<String> userTokens(AshbyUser user) {
        Set<String> tokens = new LinkedHashSet<>();
        tokens.addAll(tokenize(user.firstName()));
        tokens.addAll(tokenize(user.lastName()));
        String email = user.email() == null ? "" : user.email();
        int at = email.indexOf('@');
        tokens.addAll(tokenize(at >= 0 ? email.substring(0, at) : email));
        tokens.removeIf(token -> token.length() < 2);
        return tokens;
    }

    private List<AshbyUser> listEnabledUsers(WriteAudit audit) {
        Map<String, AshbyUser> users = new LinkedHashMap<>();
        String cursor = null;
        for (int page = 0; page < USER_LIST_MAX_PAGES; page++) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("limit", 100);
            payload.put("cursor", cursor);
            JsonNode response = rpcClient.call("user.list", payload, audit);
            JsonNode results = response.path("results");
            if (results.isArray()) {
                for (JsonNode row : results) {
                    String id = JsonFields.text(row, "id");
                    boolean enabled = !row.has("isEnabled") || row.path("isEnabled").asBoolean(false);
                    if (id.isEmpty() || !enabled) {
                        continue;
                    }
                    users.putIfAbsent(id, new AshbyUser(
                        id,
                        JsonFields.text(row, "firstName"),
                        JsonFields.text(row, "lastName"),
                        JsonFields.text(row, "email"),
                        true
                    ));
                }
            }
            String nextCursor = JsonFields.text(response, "nextCursor");
            if (!response.path("moreDataAvailable").asBoolean(false) || nextCursor.isEmpty()) {
                break;
            }
            cursor = nextCursor;
        }
        return new ArrayList<>(users.values());
    }

    private CreditedUserResolution remember(CreditedUserResolution resolution) {
        long ttlMs = settings.getCreditedUserCacheSeconds() * 1000L;
        if (ttlMs > 0) {
            cache.set(new CachedResolution(resolution.userId(), clock.millis() + ttlMs));
        }
        return resolution;
    }

    private record CachedResolution(String userId, long expiresAtMs) {
    }
}
