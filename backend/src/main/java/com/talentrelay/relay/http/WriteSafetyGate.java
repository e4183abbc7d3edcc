package com.talentrelay.relay.http;

import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.model.WriteAudit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Blocks state-mutating Ashby RPC calls unless writes are enabled, the method is allowlisted and the
 * caller presented the expected confirmation token. Read-only methods pass through untouched.
 *
 * <p>A block is final for the triggering call. Nothing in the relay retries a blocked write.
 */
@Component
public class WriteSafetyGate {
    private static final Logger log = LoggerFactory.getLogger(WriteSafetyGate.class);
    private static final Pattern MUTATING_VERB = Pattern.compile(
        "(add|anonymize|archive|cancel|change|create|delete|remove|restore|set|submit|transfer|update|upload)",
        Pattern.CASE_INSENSITIVE
    );

    public static final String WRITE_DISABLED = "write_disabled";
    public static final String METHOD_NOT_ALLOWLISTED = "method_not_allowlisted";
    public static final String MISSING_CONFIRMATION = "missing_confirmation";
    public static final String INVALID_CONFIRMATION = "invalid_confirmation";
    public static final String INVALID_PAYLOAD = "invalid_payload";
    public static final String EMPTY_PAYLOAD = "empty_payload";

    private final RelayProperties.Write settings;

    public WriteSafetyGate(RelayProperties properties) {
        this.settings = properties.getAshby().getWrite();
    }

    public static String normalizeMethodName(String methodName) {
        if (methodName == null) {
            return "";
        }
        String value = methodName.trim();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        return value;
    }

    /**
     * Matches the verb pattern against the part of the name after the first dot, or the whole name.
     */
    public static boolean isMutating(String methodName) {
        String normalized = normalizeMethodName(methodName);
        if (normalized.isEmpty()) {
            return false;
        }
        int dot = normalized.indexOf('.');
        String operation = dot >= 0 ? normalized.substring(dot + 1) : normalized;
        return MUTATING_VERB.matcher(operation).find();
    }

    public boolean isAllowlisted(String methodName) {
        return settings.getAllowedMethods().contains(normalizeMethodName(methodName));
    }

    public boolean isWriteEnabled() {
        return settings.isEnabled();
    }

    public void guard(String methodName, Map<String, ?> payload, WriteAudit audit, RpcCallOptions options) {
        String method = normalizeMethodName(methodName);
        if (!isMutating(method)) {
            return;
        }
        WriteAudit safeAudit = audit == null ? WriteAudit.background("") : audit;

        if (!settings.isEnabled()) {
            throw block(method, WRITE_DISABLED,
                "Ashby write blocked. Set relay.ashby.write.enabled=true only after explicit approval and safety checks.",
                safeAudit);
        }
        if (!settings.getAllowedMethods().contains(method)) {
            throw block(method, METHOD_NOT_ALLOWLISTED,
                "Ashby write blocked for non-allowlisted method: " + method, safeAudit);
        }
        if (settings.isRequireConfirmation()) {
            String confirmation = options == null ? "" : options.writeConfirmation();
            if (confirmation.isEmpty()) {
                throw block(method, MISSING_CONFIRMATION,
                    "Ashby write blocked. Missing write confirmation token.", safeAudit);
            }
            if (!confirmation.equals(settings.getExpectedConfirmation())) {
                throw block(method, INVALID_CONFIRMATION,
                    "Ashby write blocked. Invalid write confirmation token.", safeAudit);
            }
        }
        if (payload == null) {
            throw block(method, INVALID_PAYLOAD, "Ashby write blocked. Invalid write payload.", safeAudit);
        }
        if (payload.isEmpty()) {
            throw block(method, EMPTY_PAYLOAD, "Ashby write blocked. Empty write payload.", safeAudit);
        }
    }

    private WriteBlockedException block(String method, String reason, String message, WriteAudit audit) {
        log.warn(
            "ashby.write.blocked method={} reason={} requestId={} route={} runId={} actionId={}",
            method,
            reason,
            audit.requestId(),
            audit.route(),
            audit.runId(),
            audit.actionId()
        );
        return new WriteBlockedException(method, reason, message);
    }
}
