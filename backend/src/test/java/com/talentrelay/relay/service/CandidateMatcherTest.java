package com.talentrelay.relay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentrelay.config.RelayProperties;
import com.talentrelay.relay.http.AshbyRpcClient;
import com.talentrelay.relay.index.CandidateSummaryMapper;
import com.talentrelay.relay.model.CandidateSummary;
import com.talentrelay.relay.model.SourceProfile;
import com.talentrelay.relay.model.WriteAudit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateMatcherTest {
    private static final WriteAudit AUDIT = WriteAudit.background("test");
    private static final SourceProfile JANE = new SourceProfile(
        "g1", "Jane Doe", "Jane@Example.com", "", "https://www.linkedin.com/in/jane-doe"
    );

    @Mock
    private AshbyRpcClient rpcClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void searchesByEmailAndNameAndPrefersEmailOverName() throws Exception {
        when(rpcClient.results("candidate.search", Map.of("email", "Jane@Example.com"), AUDIT)).thenReturn(objectMapper.readTree(
            "[{\"id\":\"e1\",\"name\":\"J. Doe\",\"primaryEmailAddress\":{\"value\":\"jane@example.com\"}}]"
        ));
        when(rpcClient.results("candidate.search", Map.of("name", "Jane Doe"), AUDIT)).thenReturn(objectMapper.readTree(
            "[{\"id\":\"n1\",\"name\":\"Jane Doe\"},{\"id\":\"e1\",\"name\":\"J. Doe\"}]"
        ));

        CandidateMatcher.Match match = new CandidateMatcher(rpcClient, new CandidateSummaryMapper(new RelayProperties()))
            .findExisting(JANE, AUDIT);

        assertThat(match.candidate().id()).isEqualTo("e1");
        assertThat(match.strategy()).isEqualTo(CandidateMatcher.STRATEGY_EMAIL);
    }

    @Test
    void noResultsMeansNoMatch() throws Exception {
        SourceProfile nameOnly = new SourceProfile("g1", "Jane Doe", "", "", "");
        when(rpcClient.results("candidate.search", Map.of("name", "Jane Doe"), AUDIT)).thenReturn(objectMapper.readTree("[]"));

        assertThat(new CandidateMatcher(rpcClient, new CandidateSummaryMapper(new RelayProperties())).findExisting(nameOnly, AUDIT))
            .isNull();
    }

    @Test
    void priorityIsLinkedInThenEmailThenNameThenFirst() {
        CandidateSummary first = summary("first", "Someone", "", List.of());
        CandidateSummary byName = summary("name", "jane doe", "", List.of());
        CandidateSummary byEmail = summary("email", "Other", "jane@example.com", List.of());
        CandidateSummary byLinkedIn = summary("li", "Other", "", List.of("linkedin.com/in/jane-doe"));

        assertThat(CandidateMatcher.choose(JANE, List.of(first, byName, byEmail, byLinkedIn)).candidate().id()).isEqualTo("li");
        assertThat(CandidateMatcher.choose(JANE, List.of(first, byName, byEmail)).candidate().id()).isEqualTo("email");
        assertThat(CandidateMatcher.choose(JANE, List.of(first, byName)).strategy()).isEqualTo(CandidateMatcher.STRATEGY_NAME);
        assertThat(CandidateMatcher.choose(JANE, List.of(first)).strategy()).isEqualTo(CandidateMatcher.STRATEGY_FIRST_RESULT);
    }

    private static CandidateSummary summary(String id, String name, String email, List<String> keys) {
        return new CandidateSummary(id, name, "https://app.ashbyhq.com/candidates/" + id, List.of(), keys, 0L, "", "", email);
    }
}
