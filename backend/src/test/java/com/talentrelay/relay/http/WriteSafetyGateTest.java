package com.talentrelay.relay.http;

import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.model.WriteAudit;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WriteSafetyGateTest {
    private static final WriteAudit AUDIT = new WriteAudit("req-1", "/api/test", "run-1", "action-1");

    @Test
    void classifiesMethodsByVerbAfterFirstDot() {
        assertThat(WriteSafetyGate.isMutating("candidate.create")).isTrue();
        assertThat(WriteSafetyGate.isMutating("application.changeStage")).isTrue();
        assertThat(WriteSafetyGate.isMutating("/candidate.addProject")).isTrue();
        assertThat(WriteSafetyGate.isMutating("customField.setValue")).isTrue();
        assertThat(WriteSafetyGate.isMutating("candidate.list")).isFalse();
        assertThat(WriteSafetyGate.isMutating("candidate.search")).isFalse();
        assertThat(WriteSafetyGate.isMutating("jobInterviewPlan.info")).isFalse();
        assertThat(WriteSafetyGate.isMutating("")).isFalse();
    }

    @Test
    void readOnlyMethodsPassEvenWithWritesDisabled() {
        WriteSafetyGate gate = new WriteSafetyGate(new RelayProperties());
        assertThatCode(() -> gate.guard("candidate.list", null, AUDIT, RpcCallOptions.none()))
            .doesNotThrowAnyException();
    }

    @Test
    void blocksWhenWritesDisabled() {
        WriteSafetyGate gate = new WriteSafetyGate(new RelayProperties());
        assertBlocked(gate, "candidate.create", Map.of("name", "Jane"), RpcCallOptions.none(), WriteSafetyGate.WRITE_DISABLED);
        assertBlocked(
            gate,
            "candidate.create",
            Map.of("name", "Jane"),
            RpcCallOptions.confirmed(RelayProperties.DEFAULT_WRITE_CONFIRMATION),
            WriteSafetyGate.WRITE_DISABLED
        );
    }

    @Test
    void blocksMethodsOutsideAllowlist() {
        WriteSafetyGate gate = new WriteSafetyGate(enabledProperties());
        assertBlocked(
            gate,
            "application.update",
            Map.of("applicationId", "a1"),
            RpcCallOptions.confirmed(RelayProperties.DEFAULT_WRITE_CONFIRMATION),
            WriteSafetyGate.METHOD_NOT_ALLOWLISTED
        );
    }

    @Test
    void requiresMatchingConfirmation() {
        WriteSafetyGate gate = new WriteSafetyGate(enabledProperties());
        assertBlocked(gate, "candidate.create", Map.of("name", "Jane"), RpcCallOptions.none(), WriteSafetyGate.MISSING_CONFIRMATION);
        assertBlocked(
            gate,
            "candidate.create",
            Map.of("name", "Jane"),
            RpcCallOptions.confirmed("yes please"),
            WriteSafetyGate.INVALID_CONFIRMATION
        );
    }

    @Test
    void rejectsMissingOrEmptyPayloadEvenWithoutConfirmationRequirement() {
        RelayProperties properties = enabledProperties();
        properties.getAshby().getWrite().setRequireConfirmation(false);
        WriteSafetyGate gate = new WriteSafetyGate(properties);

        assertBlocked(gate, "candidate.create", null, RpcCallOptions.none(), WriteSafetyGate.INVALID_PAYLOAD);
        assertBlocked(gate, "candidate.create", Map.of(), RpcCallOptions.none(), WriteSafetyGate.EMPTY_PAYLOAD);
    }

    @Test
    void confirmedAllowlistedWriteStillNeedsNonEmptyPayload() {
        WriteSafetyGate gate = new WriteSafetyGate(enabledProperties());
        assertBlocked(
            gate,
            "candidate.create",
            Map.of(),
            RpcCallOptions.confirmed(RelayProperties.DEFAULT_WRITE_CONFIRMATION),
            WriteSafetyGate.EMPTY_PAYLOAD
        );
    }

    @Test
    void allowsConfirmedAllowlistedWrite() {
        WriteSafetyGate gate = new WriteSafetyGate(enabledProperties());
        assertThatCode(() -> gate.guard(
            "/candidate.create",
            Map.of("name", "Jane"),
            AUDIT,
            RpcCallOptions.confirmed(" " + RelayProperties.DEFAULT_WRITE_CONFIRMATION + " ")
        )).doesNotThrowAnyException();
        assertThat(gate.isAllowlisted("candidate.create")).isTrue();
        assertThat(gate.isAllowlisted("application.update")).isFalse();
    }

    private static RelayProperties enabledProperties() {
        RelayProperties properties = new RelayProperties();
        properties.getAshby().getWrite().setEnabled(true);
        return properties;
    }

    private static void assertBlocked(
        WriteSafetyGate gate,
        String method,
        Map<String, ?> payload,
        RpcCallOptions options,
        String reason
    ) {
        assertThatThrownBy(() -> gate.guard(method, payload, AUDIT, options))
            .isInstanceOf(WriteBlockedException.class)
            .satisfies(error -> {
                WriteBlockedException blocked = (WriteBlockedException) error;
                assertThat(blocked.getReason()).isEqualTo(reason);
                assertThat(blocked.getMethod()).isEqualTo(WriteSafetyGate.normalizeMethodName(method));
            });
    }
}
