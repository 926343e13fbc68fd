package com.delta.research.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "research")
public class ResearchProperties {
    private static final String DEFAULT_USER_AGENT = "research-pipeline/0.1 (+contact)";

    private Http http = new Http();
    private Sources sources = new Sources();
    private Jobs jobs = new Jobs();
    private Plan plan = new Plan();
    private Worker worker = new Worker();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public Plan getPlan() {
        return plan;
    }

    public void setPlan(Plan plan) {
        this.plan = plan;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public static String normalizeUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return userAgent.trim();
    }

    public static class Http {
        private String userAgent;
        private int requestTimeoutSeconds = 30;
        private int maxRetries = 1;
        private int perHostDelayMs = 0;
        private int globalConcurrency = 8;
        private int maxFetchBytes = 2_000_000;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public int getPerHostDelayMs() {
            return Math.max(0, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = perHostDelayMs;
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = globalConcurrency;
        }

        public int getMaxFetchBytes() {
            return maxFetchBytes;
        }

        public void setMaxFetchBytes(int maxFetchBytes) {
            if (maxFetchBytes < 1) {
                throw new IllegalArgumentException("research.http.max-fetch-bytes must be positive, got " + maxFetchBytes);
            }
            this.maxFetchBytes = maxFetchBytes;
        }
    }

    public static class Sources {
        private int maxAttempts = 3;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Jobs {
        private int maxAttempts = 10;
        private String jobType = "company_research_run";
        private int staleLockMinutes = 30;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public String getJobType() {
            return jobType == null || jobType.isBlank() ? "company_research_run" : jobType.trim();
        }

        public void setJobType(String jobType) {
            this.jobType = jobType;
        }

        public int getStaleLockMinutes() {
            return Math.max(1, staleLockMinutes);
        }

        public void setStaleLockMinutes(int staleLockMinutes) {
            this.staleLockMinutes = staleLockMinutes;
        }
    }

    public static class Plan {
        private int stepMaxAttempts = 3;

        public int getStepMaxAttempts() {
            return Math.max(1, stepMaxAttempts);
        }

        public void setStepMaxAttempts(int stepMaxAttempts) {
            this.stepMaxAttempts = stepMaxAttempts;
        }
    }

    public static class Worker {
        private int pollSleepSeconds = 2;
        private Daemon daemon = new Daemon();
        private Cli cli = new Cli();

        public int getPollSleepSeconds() {
            return Math.max(1, pollSleepSeconds);
        }

        public void setPollSleepSeconds(int pollSleepSeconds) {
            this.pollSleepSeconds = pollSleepSeconds;
        }

        public Daemon getDaemon() {
            return daemon;
        }

        public void setDaemon(Daemon daemon) {
            this.daemon = daemon;
        }

        public Cli getCli() {
            return cli;
        }

        public void setCli(Cli cli) {
            this.cli = cli;
        }
    }

    public static class Daemon {
        private boolean enabled = false;
        private int workers = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkers() {
            return Math.max(1, workers);
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }
    }

    public static class Cli {
        private boolean enabled = false;
        private boolean exitAfterRun = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
