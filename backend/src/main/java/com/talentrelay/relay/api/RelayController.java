package com.talentrelay.relay.api;

import com.talentrelay.relay.index.CandidateIndex;
import com.talentrelay.relay.index.CandidateIndexScheduler;
import com.talentrelay.relay.index.RefreshOptions;
import com.talentrelay.relay.model.IndexMetadata;
import com.talentrelay.relay.model.IndexRefreshRequest;
import com.talentrelay.relay.model.LinkedInLookupRequest;
import com.talentrelay.relay.model.LinkedInLookupResult;
import com.talentrelay.relay.model.UploadRequest;
import com.talentrelay.relay.model.UploadResult;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.service.LinkedInLookupService;
import com.talentrelay.relay.service.UploadOrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class RelayController {
    private static final Logger log = LoggerFactory.getLogger(RelayController.class);

    static final String LOOKUP_ROUTE = "/api/ashby/candidates/lookup-by-linkedin";
    static final String UPLOAD_ROUTE = "/api/ashby/candidates/upload-to-job";
    static final String REFRESH_ROUTE = "/api/ashby/index/refresh";
    static final String STATUS_ROUTE = "/api/ashby/index/status";

    private final LinkedInLookupService lookupService;
    private final UploadOrchestratorService uploadService;
    private final CandidateIndexScheduler scheduler;

    public RelayController(
        LinkedInLookupService lookupService,
        UploadOrchestratorService uploadService,
        CandidateIndexScheduler scheduler
    ) {
        this.lookupService = lookupService;
        this.uploadService = uploadService;
        this.scheduler = scheduler;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("ok", true);
    }

    @PostMapping(LOOKUP_ROUTE)
    public RelayResponse<LinkedInLookupResult> lookupByLinkedIn(
        @RequestBody(required = false) LinkedInLookupRequest request,
        @RequestAttribute(RelayRequestFilter.REQUEST_ID_ATTRIBUTE) String requestId
    ) {
        WriteAudit audit = request == null
            ? new WriteAudit(requestId, LOOKUP_ROUTE, "", "")
            : new WriteAudit(requestId, LOOKUP_ROUTE, request.runId(), request.actionId());
        logReceived(audit);
        return RelayResponse.success(lookupService.resolveByLinkedIn(request, audit), requestId);
    }

    @PostMapping(UPLOAD_ROUTE)
    public RelayResponse<UploadResult> uploadToJob(
        @RequestBody(required = false) UploadRequest request,
        @RequestAttribute(RelayRequestFilter.REQUEST_ID_ATTRIBUTE) String requestId
    ) {
        WriteAudit audit = request == null
            ? new WriteAudit(requestId, UPLOAD_ROUTE, "", "")
            : new WriteAudit(requestId, UPLOAD_ROUTE, request.runId(), request.actionId());
        logReceived(audit);
        return RelayResponse.success(uploadService.upload(request, audit), requestId);
    }

    @PostMapping(REFRESH_ROUTE)
    public RelayResponse<IndexMetadata> refreshIndex(
        @RequestBody(required = false) IndexRefreshRequest request,
        @RequestAttribute(RelayRequestFilter.REQUEST_ID_ATTRIBUTE) String requestId
    ) {
        WriteAudit audit = request == null
            ? new WriteAudit(requestId, REFRESH_ROUTE, "", "")
            : new WriteAudit(requestId, REFRESH_ROUTE, request.runId(), request.actionId());
        boolean forceFull = request != null && Boolean.TRUE.equals(request.forceFull());
        logReceived(audit);
        CandidateIndex index = scheduler.ensureFresh(audit, RefreshOptions.forced(forceFull));
        return RelayResponse.success(scheduler.metadata(index), requestId);
    }

    @PostMapping(STATUS_ROUTE)
    public RelayResponse<IndexMetadata> indexStatus(
        @RequestAttribute(RelayRequestFilter.REQUEST_ID_ATTRIBUTE) String requestId
    ) {
        return RelayResponse.success(scheduler.metadata(), requestId);
    }

    private static void logReceived(WriteAudit audit) {
        log.info(
            "request.received requestId={} route={} runId={} actionId={}",
            audit.requestId(),
            audit.route(),
            audit.runId(),
            audit.actionId()
        );
    }
}
