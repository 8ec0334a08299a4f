package com.leadradar.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    public static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/120.0.0.0 Safari/537.36";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 0;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int perHostDelayMs = 1000;
    private int workerCount = 2;
    private int pageDelayMs = 2000;
    private int defaultMaxPages = 3;
    private int maxCardsPerPage = 200;
    private int maxCrawlUrls = 50;
    private Browser browser = new Browser();
    private Sites sites = new Sites();
    private Indicators indicators = new Indicators();
    private Cli cli = new Cli();

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
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getPerHostDelayMs() {
        return Math.max(0, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(0, perHostDelayMs);
    }

    public int getWorkerCount() {
        return Math.max(1, workerCount);
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = Math.max(1, workerCount);
    }

    public int getPageDelayMs() {
        return Math.max(0, pageDelayMs);
    }

    public void setPageDelayMs(int pageDelayMs) {
        this.pageDelayMs = Math.max(0, pageDelayMs);
    }

    public int getDefaultMaxPages() {
        return Math.max(1, defaultMaxPages);
    }

    public void setDefaultMaxPages(int defaultMaxPages) {
        this.defaultMaxPages = Math.max(1, defaultMaxPages);
    }

    public int getMaxCardsPerPage() {
        return Math.max(1, maxCardsPerPage);
    }

    public void setMaxCardsPerPage(int maxCardsPerPage) {
        this.maxCardsPerPage = Math.max(1, maxCardsPerPage);
    }

    public int getMaxCrawlUrls() {
        return Math.max(1, maxCrawlUrls);
    }

    public void setMaxCrawlUrls(int maxCrawlUrls) {
        this.maxCrawlUrls = Math.max(1, maxCrawlUrls);
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Sites getSites() {
        return sites;
    }

    public void setSites(Sites sites) {
        this.sites = sites;
    }

    public Indicators getIndicators() {
        return indicators;
    }

    public void setIndicators(Indicators indicators) {
        this.indicators = indicators;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Browser {
        private boolean enabled = true;
        private boolean headless = true;
        private int navigationTimeoutMs = 60000;
        private int challengeMaxWaitMs = 30000;
        private int challengePollMs = 2000;
        private int challengeMinBytes = 10000;
        private int challengeClearBytes = 50000;
        private double pacingScale = 1.0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getNavigationTimeoutMs() {
            return navigationTimeoutMs;
        }

        public void setNavigationTimeoutMs(int navigationTimeoutMs) {
            this.navigationTimeoutMs = Math.max(1000, navigationTimeoutMs);
        }

        public int getChallengeMaxWaitMs() {
            return challengeMaxWaitMs;
        }

        public void setChallengeMaxWaitMs(int challengeMaxWaitMs) {
            this.challengeMaxWaitMs = Math.max(0, challengeMaxWaitMs);
        }

        public int getChallengePollMs() {
            return challengePollMs;
        }

        public void setChallengePollMs(int challengePollMs) {
            this.challengePollMs = Math.max(1, challengePollMs);
        }

        public int getChallengeMinBytes() {
            return challengeMinBytes;
        }

        public void setChallengeMinBytes(int challengeMinBytes) {
            this.challengeMinBytes = Math.max(0, challengeMinBytes);
        }

        public int getChallengeClearBytes() {
            return challengeClearBytes;
        }

        public void setChallengeClearBytes(int challengeClearBytes) {
            this.challengeClearBytes = Math.max(0, challengeClearBytes);
        }

        public double getPacingScale() {
            return pacingScale;
        }

        public void setPacingScale(double pacingScale) {
            this.pacingScale = Math.max(0.0, pacingScale);
        }
    }

    public static class Sites {
        private List<String> scriptedHosts = new ArrayList<>(List.of(
            "g2.com",
            "getapp.com",
            "capterra.com",
            "trustradius.com",
            "softwareadvice.com"
        ));
        private List<String> paginatedHosts = new ArrayList<>(List.of("g2.com", "trustradius.com", "getapp.com"));
        private List<String> deniedHosts = new ArrayList<>(List.of("capterra.com", "capterra.ca"));
        private List<String> authGatedHosts = new ArrayList<>(List.of("linkedin.com", "glassdoor.com"));

        public List<String> getScriptedHosts() {
            return scriptedHosts;
        }

        public void setScriptedHosts(List<String> scriptedHosts) {
            this.scriptedHosts = scriptedHosts == null ? new ArrayList<>() : scriptedHosts;
        }

        public List<String> getPaginatedHosts() {
            return paginatedHosts;
        }

        public void setPaginatedHosts(List<String> paginatedHosts) {
            this.paginatedHosts = paginatedHosts == null ? new ArrayList<>() : paginatedHosts;
        }

        public List<String> getDeniedHosts() {
            return deniedHosts;
        }

        public void setDeniedHosts(List<String> deniedHosts) {
            this.deniedHosts = deniedHosts == null ? new ArrayList<>() : deniedHosts;
        }

        public List<String> getAuthGatedHosts() {
            return authGatedHosts;
        }

        public void setAuthGatedHosts(List<String> authGatedHosts) {
            this.authGatedHosts = authGatedHosts == null ? new ArrayList<>() : authGatedHosts;
        }
    }

    public static class Indicators {
        private String file;
        private int checkTimeoutSeconds = 10;

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public int getCheckTimeoutSeconds() {
            return checkTimeoutSeconds;
        }

        public void setCheckTimeoutSeconds(int checkTimeoutSeconds) {
            this.checkTimeoutSeconds = Math.max(1, checkTimeoutSeconds);
        }
    }

    public static class Cli {
        private boolean run = false;
        private String urls = "";
        private String file;
        private int maxPages = 3;
        private boolean save = true;
        private String exportPath;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getUrls() {
            return urls;
        }

        public void setUrls(String urls) {
            this.urls = urls == null ? "" : urls;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public boolean isSave() {
            return save;
        }

        public void setSave(boolean save) {
            this.save = save;
        }

        public String getExportPath() {
            return exportPath;
        }

        public void setExportPath(String exportPath) {
            this.exportPath = exportPath;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
