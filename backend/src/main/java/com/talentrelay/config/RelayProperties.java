package com.talentrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@ConfigurationProperties(prefix = "relay")
public class RelayProperties {
    public static final String DEFAULT_WRITE_CONFIRMATION = "I_UNDERSTAND_THIS_WRITES_TO_ASHBY";
    private static final List<String> DEFAULT_ALLOWED_METHODS = List.of(
        "candidate.create",
        "candidate.addProject",
        "customField.setValue",
        "customField.setValues",
        "candidate.createNote",
        "application.create",
        "application.changeStage",
        "application.changeSource"
    );

    private String backendSharedToken = "";
    private Ashby ashby = new Ashby();
    private Index index = new Index();
    private Upload upload = new Upload();
    private Gem gem = new Gem();

    public String getBackendSharedToken() {
        return backendSharedToken;
    }

    public void setBackendSharedToken(String backendSharedToken) {
        this.backendSharedToken = trimToEmpty(backendSharedToken);
    }

    public Ashby getAshby() {
        return ashby;
    }

    public void setAshby(Ashby ashby) {
        this.ashby = ashby;
    }

    public Index getIndex() {
        return index;
    }

    public void setIndex(Index index) {
        this.index = index;
    }

    public Upload getUpload() {
        return upload;
    }

    public void setUpload(Upload upload) {
        this.upload = upload;
    }

    public Gem getGem() {
        return gem;
    }

    public void setGem(Gem gem) {
        this.gem = gem;
    }

    public static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    public static String stripTrailingSlash(String value) {
        String trimmed = trimToEmpty(value);
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public static class Ashby {
        private String apiKey = "";
        private String baseUrl = "https://api.ashbyhq.com";
        private String appBaseUrl = "https://app.ashbyhq.com";
        private int connectTimeoutSeconds = 10;
        private Write write = new Write();

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = trimToEmpty(apiKey);
        }

        public String getBaseUrl() {
            return stripTrailingSlash(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAppBaseUrl() {
            return stripTrailingSlash(appBaseUrl);
        }

        public void setAppBaseUrl(String appBaseUrl) {
            this.appBaseUrl = appBaseUrl;
        }

        public int getConnectTimeoutSeconds() {
            return Math.max(1, connectTimeoutSeconds);
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
        }

        public Write getWrite() {
            return write;
        }

        public void setWrite(Write write) {
            this.write = write;
        }
    }

    public static class Write {
        private boolean enabled = false;
        private boolean requireConfirmation = true;
        private String confirmationToken = "";
        private Set<String> allowedMethods = new LinkedHashSet<>(DEFAULT_ALLOWED_METHODS);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRequireConfirmation() {
            return requireConfirmation;
        }

        public void setRequireConfirmation(boolean requireConfirmation) {
            this.requireConfirmation = requireConfirmation;
        }

        public String getConfirmationToken() {
            return confirmationToken;
        }

        public void setConfirmationToken(String confirmationToken) {
            this.confirmationToken = trimToEmpty(confirmationToken);
        }

        /**
         * The token a caller must present. Falls back to {@link RelayProperties#DEFAULT_WRITE_CONFIRMATION}
         * when no token is configured.
         */
        public String getExpectedConfirmation() {
            return confirmationToken.isEmpty() ? DEFAULT_WRITE_CONFIRMATION : confirmationToken;
        }

        public Set<String> getAllowedMethods() {
            return allowedMethods;
        }

        public void setAllowedMethods(Set<String> allowedMethods) {
            Set<String> cleaned = new LinkedHashSet<>();
            if (allowedMethods != null) {
                for (String method : allowedMethods) {
                    String value = trimToEmpty(method);
                    if (!value.isEmpty()) {
                        cleaned.add(value);
                    }
                }
            }
            this.allowedMethods = cleaned;
        }
    }

    public static class Index {
        private long ttlSeconds = 600;
        private int scanMax = 20000;
        private int pageSize = 100;

        public long getTtlSeconds() {
            return Math.max(0, ttlSeconds);
        }

        public void setTtlSeconds(long ttlSeconds) {
            this.ttlSeconds = Math.max(0, ttlSeconds);
        }

        public int getScanMax() {
            return Math.max(1, scanMax);
        }

        public void setScanMax(int scanMax) {
            this.scanMax = Math.max(1, scanMax);
        }

        public int getPageSize() {
            return Math.max(1, Math.min(pageSize, 100));
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class Upload {
        private String sourcePreferredTitle = "sourced: gem";
        private String sourceKeyword = "gem";
        private String creditedToUserId = "";
        private String creditedToUserEmail = "";
        private long creditedUserCacheSeconds = 300;

        public String getSourcePreferredTitle() {
            return sourcePreferredTitle;
        }

        public void setSourcePreferredTitle(String sourcePreferredTitle) {
            this.sourcePreferredTitle = trimToEmpty(sourcePreferredTitle);
        }

        public String getSourceKeyword() {
            return sourceKeyword;
        }

        public void setSourceKeyword(String sourceKeyword) {
            this.sourceKeyword = trimToEmpty(sourceKeyword);
        }

        public String getCreditedToUserId() {
            return creditedToUserId;
        }

        public void setCreditedToUserId(String creditedToUserId) {
            this.creditedToUserId = trimToEmpty(creditedToUserId);
        }

        public String getCreditedToUserEmail() {
            return creditedToUserEmail;
        }

        public void setCreditedToUserEmail(String creditedToUserEmail) {
            this.creditedToUserEmail = trimToEmpty(creditedToUserEmail);
        }

        public long getCreditedUserCacheSeconds() {
            return Math.max(0, creditedUserCacheSeconds);
        }

        public void setCreditedUserCacheSeconds(long creditedUserCacheSeconds) {
            this.creditedUserCacheSeconds = Math.max(0, creditedUserCacheSeconds);
        }
    }

    public static class Gem {
        private String apiKey = "";
        private String baseUrl = "https://api.gem.com";

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = trimToEmpty(apiKey);
        }

        public String getBaseUrl() {
            return stripTrailingSlash(baseUrl);
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
