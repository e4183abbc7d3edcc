package com.talentrelay.relay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentrelay.relay.http.AshbyRpcClient;
import com.talentrelay.relay.http.RpcCallOptions;
import com.talentrelay.relay.http.WriteSafetyGate;
import com.talentrelay.relay.index.CandidateSummaryMapper;
import com.talentrelay.relay.model.CandidateSummary;
import com.talentrelay.relay.model.CreditedUserResolution;
import com.talentrelay.relay.model.InterviewStage;
import com.talentrelay.relay.model.LinkedInLookupRequest;
import com.talentrelay.relay.model.LinkedInLookupResult;
import com.talentrelay.relay.model.SourceProfile;
import com.talentrelay.relay.model.StageSelection;
import com.talentrelay.relay.model.UploadRequest;
import com.talentrelay.relay.model.UploadResult;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.util.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Uploads a Gem candidate into an Ashby job: finds or creates the candidate, then finds or creates the
 * application and brings an existing one in line with the resolved source, credited user and stage.
 * Any upstream failure aborts the upload; records created before the failure are left in place.
 */
@Service
public class UploadOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(UploadOrchestratorService.class);
    static final String APPLICATION_UPDATE = "application.update";

    public static final String UPDATE_SOURCE = "source";
    public static final String UPDATE_CREDITED_TO_USER = "credited_to_user";
    public static final String UPDATE_STAGE = "stage";

    private final AshbyRpcClient rpcClient;
    private final WriteSafetyGate gate;
    private final SourceProfileReader profileReader;
    private final SourceResolver sourceResolver;
    private final CreditedUserResolver creditedUserResolver;
    private final StageSelector stageSelector;
    private final LinkedInLookupService lookupService;
    private final CandidateMatcher candidateMatcher;
    private final JobResolver jobResolver;
    private final CandidateSummaryMapper mapper;

    public UploadOrchestratorService(
        AshbyRpcClient rpcClient,
        WriteSafetyGate gate,
        SourceProfileReader profileReader,
        SourceResolver sourceResolver,
        CreditedUserResolver creditedUserResolver,
        StageSelector stageSelector,
        LinkedInLookupService lookupService,
        CandidateMatcher candidateMatcher,
        JobResolver jobResolver,
        CandidateSummaryMapper mapper
    ) {
        this.rpcClient = rpcClient;
        this.gate = gate;
        this.profileReader = profileReader;
        this.sourceResolver = sourceResolver;
        this.creditedUserResolver = creditedUserResolver;
        this.stageSelector = stageSelector;
        this.lookupService = lookupService;
        this.candidateMatcher = candidateMatcher;
        this.jobResolver = jobResolver;
        this.mapper = mapper;
    }

    public UploadResult upload(UploadRequest request, WriteAudit audit) {
        if (request == null || isBlank(request.gemCandidateId())) {
            throw new RelayValidationException("gemCandidateId is required.");
        }
        if (isBlank(request.jobId()) && isBlank(request.jobName())) {
            throw new RelayValidationException("jobId or jobName is required.");
        }
        RpcCallOptions writeOptions = RpcCallOptions.confirmed(request.writeConfirmation());
        String jobId = jobResolver.resolveJobId(request.jobId(), request.jobName(), audit);

        SourceProfile profile = profileReader.load(request.gemCandidateId().trim(), audit);
        String sourceId = sourceResolver.resolveSourceId(audit);
        CreditedUserResolution creditedUser = creditedUserResolver.resolve(audit);
        StageSelection stage = stageSelector.pickStage(loadStages(jobId, audit));
        String stageId = stage.stage() == null ? null : stage.stage().id();

        ResolvedCandidate candidate = findOrCreateCandidate(profile, sourceId, creditedUser.userId(), request, audit, writeOptions);

        List<String> updatesApplied = new ArrayList<>();
        JsonNode existing = findApplication(candidate.id(), jobId, audit);
        String applicationId;
        boolean applicationCreated;
        if (existing == null) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("candidateId", candidate.id());
            payload.put("jobId", jobId);
            payload.put("sourceId", sourceId);
            payload.put("creditedToUserId", creditedUser.userId());
            payload.put("interviewStageId", stageId);
            JsonNode created = rpcClient.call("application.create", payload, audit, writeOptions).path("results");
            applicationId = JsonFields.text(created, "id");
            applicationCreated = true;
            log.info("Created application {} candidateId={} jobId={} requestId={}", applicationId, candidate.id(), jobId, audit.requestId());
        } else {
            applicationId = JsonFields.text(existing, "id");
            applicationCreated = false;
            alignApplication(existing, applicationId, sourceId, creditedUser.userId(), stageId, audit, writeOptions, updatesApplied);
        }

        JsonNode application = rpcClient.results("application.info", Map.of("applicationId", applicationId), audit);
        String currentStageId = JsonFields.nestedId(application, "currentInterviewStage", "currentInterviewStageId");
        String profileUrl = candidate.profileUrl();
        if (isBlank(profileUrl)) {
            CandidateSummary refreshed = mapper.toSummary(rpcClient.results("candidate.info", Map.of("id", candidate.id()), audit));
            profileUrl = refreshed == null ? "" : refreshed.profileUrl();
        }

        log.info(
            "Upload completed gemCandidateId={} candidateId={} candidateCreated={} applicationId={} applicationCreated={} updates={} requestId={}",
            request.gemCandidateId(),
            candidate.id(),
            candidate.created(),
            applicationId,
            applicationCreated,
            updatesApplied,
            audit.requestId()
        );
        return new UploadResult(
            candidate.id(),
            profileUrl,
            candidate.created(),
            candidate.strategy(),
            applicationId,
            applicationCreated,
            jobId,
            sourceId,
            creditedUser.userId(),
            creditedUser.strategy(),
            stage,
            List.copyOf(updatesApplied),
            currentStageId
        );
    }

    List<InterviewStage> loadStages(String jobId, WriteAudit audit) {
        JsonNode results = rpcClient.results("jobInterviewPlan.info", Map.of("jobId", jobId), audit);
        JsonNode rows = results.path("stages");
        if (!rows.isArray()) {
            rows = results.path("interviewStages");
        }
        List<InterviewStage> stages = new ArrayList<>();
        if (!rows.isArray()) {
            return stages;
        }
        for (JsonNode row : rows) {
            String id = JsonFields.text(row, "id");
            if (id.isEmpty()) {
                continue;
            }
            JsonNode order = row.path("orderInInterviewPlan");
            stages.add(new InterviewStage(id, JsonFields.text(row, "title"), order.isNumber() ? order.asInt() : null));
        }
        return stages;
    }

    private ResolvedCandidate findOrCreateCandidate(
        SourceProfile profile,
        String sourceId,
        String creditedToUserId,
        UploadRequest request,
        WriteAudit audit,
        RpcCallOptions writeOptions
    ) {
        if (!isBlank(profile.linkedInUrl())) {
            LinkedInLookupResult lookup = lookupService.resolveByLinkedIn(
                new LinkedInLookupRequest(profile.linkedInUrl(), null, profile.name(), false, request.runId(), request.actionId()),
                audit
            );
            if (lookup.found()) {
                CandidateSummary found = lookup.candidate();
                return new ResolvedCandidate(found.id(), found.profileUrl(), false, "linkedin_" + lookup.strategy());
            }
        }

        CandidateMatcher.Match match = candidateMatcher.findExisting(profile, audit);
        if (match != null) {
            return new ResolvedCandidate(match.candidate().id(), match.candidate().profileUrl(), false, match.strategy());
        }

        if (isBlank(profile.name())) {
            throw new RelayValidationException("Gem candidate has no name; cannot create an Ashby candidate.");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", profile.name());
        payload.put("email", profile.email());
        payload.put("phoneNumber", profile.phone());
        payload.put("linkedInUrl", profile.linkedInUrl());
        payload.put("sourceId", sourceId);
        payload.put("creditedToUserId", creditedToUserId);
        JsonNode created = rpcClient.call("candidate.create", payload, audit, writeOptions).path("results");
        CandidateSummary summary = mapper.toSummary(created);
        if (summary == null) {
            throw new IllegalStateException("Ashby candidate.create returned no candidate id");
        }
        log.info("Created Ashby candidate {} for gemCandidateId={} requestId={}", summary.id(), profile.id(), audit.requestId());
        String rawProfileUrl = JsonFields.text(created, "profileUrl");
        return new ResolvedCandidate(summary.id(), rawProfileUrl.isEmpty() ? "" : summary.profileUrl(), true, "created");
    }

    private JsonNode findApplication(String candidateId, String jobId, WriteAudit audit) {
        JsonNode candidate = rpcClient.results("candidate.info", Map.of("id", candidateId), audit);
        JsonNode applicationIds = candidate.path("applicationIds");
        if (!applicationIds.isArray()) {
            return null;
        }
        for (JsonNode idNode : applicationIds) {
            String applicationId = idNode.asText("").trim();
            if (applicationId.isEmpty()) {
                continue;
            }
            JsonNode application = rpcClient.results("application.info", Map.of("applicationId", applicationId), audit);
            if (jobId.equals(JsonFields.nestedId(application, "job", "jobId"))) {
                return application;
            }
        }
        return null;
    }

    private void alignApplication(
        JsonNode application,
        String applicationId,
        String sourceId,
        String creditedToUserId,
        String stageId,
        WriteAudit audit,
        RpcCallOptions writeOptions,
        List<String> updatesApplied
    ) {
        if (!isBlank(sourceId) && !sourceId.equals(JsonFields.nestedId(application, "source", "sourceId"))) {
            rpcClient.call("application.changeSource", Map.of("applicationId", applicationId, "sourceId", sourceId), audit, writeOptions);
            updatesApplied.add(UPDATE_SOURCE);
        }
        if (!isBlank(creditedToUserId)
            && !creditedToUserId.equals(JsonFields.nestedId(application, "creditedToUser", "creditedToUserId"))) {
            if (gate.isAllowlisted(APPLICATION_UPDATE)) {
                rpcClient.call(
                    APPLICATION_UPDATE,
                    Map.of("applicationId", applicationId, "creditedToUserId", creditedToUserId),
                    audit,
                    writeOptions
                );
                updatesApplied.add(UPDATE_CREDITED_TO_USER);
            } else {
                log.info("Skipping credited-to user update for application {}: {} is not allowlisted", applicationId, APPLICATION_UPDATE);
            }
        }
        if (!isBlank(stageId)
            && !stageId.equals(JsonFields.nestedId(application, "currentInterviewStage", "currentInterviewStageId"))) {
            rpcClient.call(
                "application.changeStage",
                Map.of("applicationId", applicationId, "interviewStageId", stageId),
                audit,
                writeOptions
            );
            updatesApplied.add(UPDATE_STAGE);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record ResolvedCandidate(String id, String profileUrl, boolean created, String strategy) {
    }
}
