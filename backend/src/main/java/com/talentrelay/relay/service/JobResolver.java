package com.talentrelay.relay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.talentrelay.relay.http.AshbyRpcClient;
import com.talentrelay.relay.model.WriteAudit;
import com.talentrelay.relay.util.JsonFields;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class JobResolver {
    private static final int JOB_LIST_MAX_PAGES = 50;

    private final AshbyRpcClient rpcClient;

    public JobResolver(AshbyRpcClient rpcClient) {
        this.rpcClient = rpcClient;
    }

    /**
     * An explicit job id wins; a job name is matched against the job catalog.
     */
    public String resolveJobId(String jobId, String jobName, WriteAudit audit) {
        if (jobId != null && !jobId.isBlank()) {
            return jobId.trim();
        }
        if (jobName == null || jobName.isBlank()) {
            throw new RelayValidationException("jobId or jobName is required.");
        }
        String match = pick(listJobs(audit), jobName);
        if (match == null) {
            throw new RelayValidationException("No Ashby job matches jobName '" + jobName.trim() + "'.");
        }
        return match;
    }

    static String pick(List<Job> jobs, String jobName) {
        String wanted = jobName.trim().toLowerCase(Locale.ROOT);
        for (Job job : jobs) {
            if (job.title().toLowerCase(Locale.ROOT).equals(wanted)) {
                return job.id();
            }
        }
        for (Job job : jobs) {
            if (job.title().toLowerCase(Locale.ROOT).contains(wanted)) {
                return job.id();
            }
        }
        return null;
    }

    private List<Job> listJobs(WriteAudit audit) {
        List<Job> jobs = new ArrayList<>();
        String cursor = null;
        for (int page = 0; page < JOB_LIST_MAX_PAGES; page++) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("limit", 100);
            payload.put("cursor", cursor);
            JsonNode response = rpcClient.call("job.list", payload, audit);
            JsonNode results = response.path("results");
            if (results.isArray()) {
                for (JsonNode row : results) {
                    String id = JsonFields.text(row, "id");
                    if (!id.isEmpty()) {
                        jobs.add(new Job(id, JsonFields.text(row, "title", "name")));
                    }
                }
            }
            String nextCursor = JsonFields.text(response, "nextCursor");
            if (!response.path("moreDataAvailable").asBoolean(false) || nextCursor.isEmpty()) {
                break;
            }
            cursor = nextCursor;
        }
        return jobs;
    }

    record Job(String id, String title) {
    }
}
