package com.datcoord.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.datcoord.session.OptimizerKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private CoordinatorConfig coordinator = new CoordinatorConfig();
    private ContentStoreConfig contentStore = new ContentStoreConfig();

    public CoordinatorConfig getCoordinator() {
        return coordinator;
    }

    public void setCoordinator(CoordinatorConfig coordinator) {
        this.coordinator = coordinator == null ? new CoordinatorConfig() : coordinator;
    }

    public ContentStoreConfig getContentStore() {
        return contentStore;
    }

    public void setContentStore(ContentStoreConfig contentStore) {
        this.contentStore = contentStore == null ? new ContentStoreConfig() : contentStore;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CoordinatorConfig {
        private String adminIdentity = "admin";
        private long rewardPerContribution = 10;
        private List<OptimizerKind> allowedOptimizers = new ArrayList<>(Arrays.asList(OptimizerKind.values()));
        private String statePath = ".datcoord/state.json";
        private String auditLogPath = ".datcoord/contributions.jsonl";

        public String getAdminIdentity() {
            return adminIdentity;
        }

        public void setAdminIdentity(String adminIdentity) {
            this.adminIdentity = adminIdentity;
        }

        public long getRewardPerContribution() {
            return rewardPerContribution;
        }

        public void setRewardPerContribution(long rewardPerContribution) {
            this.rewardPerContribution = rewardPerContribution;
        }

        public List<OptimizerKind> getAllowedOptimizers() {
            return allowedOptimizers;
        }

        public void setAllowedOptimizers(List<OptimizerKind> allowedOptimizers) {
            this.allowedOptimizers = allowedOptimizers == null
                    ? new ArrayList<>(Arrays.asList(OptimizerKind.values()))
                    : allowedOptimizers;
        }

        public String getStatePath() {
            return statePath;
        }

        public void setStatePath(String statePath) {
            this.statePath = statePath;
        }

        public String getAuditLogPath() {
            return auditLogPath;
        }

        public void setAuditLogPath(String auditLogPath) {
            this.auditLogPath = auditLogPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentStoreConfig {
        private String type = "local";
        private String localPath = ".datcoord/blobs";
        private String publisherUrl = "http://localhost:31415";
        private String aggregatorUrl = "";
        private int storageEpochs = 1;
        private int timeoutMs = 30000;
        private int maxRetries = 3;
        private long retryBackoffMs = 500;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getLocalPath() {
            return localPath;
        }

        public void setLocalPath(String localPath) {
            this.localPath = localPath;
        }

        public String getPublisherUrl() {
            return publisherUrl;
        }

        public void setPublisherUrl(String publisherUrl) {
            this.publisherUrl = publisherUrl;
        }

        public String getAggregatorUrl() {
            return aggregatorUrl;
        }

        public void setAggregatorUrl(String aggregatorUrl) {
            this.aggregatorUrl = aggregatorUrl;
        }

        public int getStorageEpochs() {
            return storageEpochs;
        }

        public void setStorageEpochs(int storageEpochs) {
            this.storageEpochs = storageEpochs;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }
}
