package com.autobulk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "autobulk")
public class AutobulkProperties {

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final Worker worker = new Worker();
    private final Recipients recipients = new Recipients();
    private final Map<String, Template> templates = new LinkedHashMap<>();
    private final Api api = new Api();

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Worker getWorker() {
        return worker;
    }

    public Recipients getRecipients() {
        return recipients;
    }

    public Map<String, Template> getTemplates() {
        return templates;
    }

    public Api getApi() {
        return api;
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Jobs {
        private int defaultMaxRetries = 3;
        private long retryBaseDelayInSeconds = 30;
        private long retryMaxDelayInSeconds = 600;

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public long getRetryBaseDelayInSeconds() {
            return retryBaseDelayInSeconds;
        }

        public void setRetryBaseDelayInSeconds(long retryBaseDelayInSeconds) {
            this.retryBaseDelayInSeconds = retryBaseDelayInSeconds;
        }

        public long getRetryMaxDelayInSeconds() {
            return retryMaxDelayInSeconds;
        }

        public void setRetryMaxDelayInSeconds(long retryMaxDelayInSeconds) {
            this.retryMaxDelayInSeconds = retryMaxDelayInSeconds;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private long pollIntervalInSeconds = 5;
        // Blank keeps stuck running jobs untouched.
        private String staleRunningTimeout = "";
        private long reaperIntervalInSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalInSeconds() {
            return pollIntervalInSeconds;
        }

        public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
            this.pollIntervalInSeconds = pollIntervalInSeconds;
        }

        public String getStaleRunningTimeout() {
            return staleRunningTimeout;
        }

        public void setStaleRunningTimeout(String staleRunningTimeout) {
            this.staleRunningTimeout = staleRunningTimeout;
        }

        public long getReaperIntervalInSeconds() {
            return reaperIntervalInSeconds;
        }

        public void setReaperIntervalInSeconds(long reaperIntervalInSeconds) {
            this.reaperIntervalInSeconds = reaperIntervalInSeconds;
        }
    }

    public static class Recipients {
        private Path cachePath;
        private String addressField = "email";

        public Path getCachePath() {
            return cachePath;
        }

        public void setCachePath(Path cachePath) {
            this.cachePath = cachePath;
        }

        public String getAddressField() {
            return addressField;
        }

        public void setAddressField(String addressField) {
            this.addressField = addressField;
        }
    }

    public static class Template {
        private String subject = "";
        private String body = "";

        public Template() {
        }

        public Template(String subject, String body) {
            this.subject = subject;
            this.body = body;
        }

        public String getSubject() {
            return subject;
        }

        public void setSubject(String subject) {
            this.subject = subject;
        }

        public String getBody() {
            return body;
        }

        public void setBody(String body) {
            this.body = body;
        }
    }

    public static class Api {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
