package com.statejobs.harvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "state-jobs-harvester/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int httpThreads = 4;
    private Search search = new Search();
    private ListSelectors listSelectors = new ListSelectors();
    private DetailSelectors detailSelectors = new DetailSelectors();
    private Identity identity = new Identity();
    private List<OrgTag> orgs = defaultOrgs();
    private Matching matching = new Matching();
    private Parsing parsing = new Parsing();
    private Robots robots = new Robots();
    private Output output = new Output();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
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

    public int getHttpThreads() {
        return Math.max(1, httpThreads);
    }

    public void setHttpThreads(int httpThreads) {
        this.httpThreads = Math.max(1, httpThreads);
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public ListSelectors getListSelectors() {
        return listSelectors;
    }

    public void setListSelectors(ListSelectors listSelectors) {
        this.listSelectors = listSelectors;
    }

    public DetailSelectors getDetailSelectors() {
        return detailSelectors;
    }

    public void setDetailSelectors(DetailSelectors detailSelectors) {
        this.detailSelectors = detailSelectors;
    }

    public Identity getIdentity() {
        return identity;
    }

    public void setIdentity(Identity identity) {
        this.identity = identity;
    }

    public List<OrgTag> getOrgs() {
        return orgs;
    }

    public void setOrgs(List<OrgTag> orgs) {
        this.orgs = orgs == null ? new ArrayList<>() : orgs;
    }

    public Matching getMatching() {
        return matching;
    }

    public void setMatching(Matching matching) {
        this.matching = matching;
    }

    public Parsing getParsing() {
        return parsing;
    }

    public void setParsing(Parsing parsing) {
        this.parsing = parsing;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
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

    private static List<OrgTag> defaultOrgs() {
        List<OrgTag> defaults = new ArrayList<>();
        defaults.add(new OrgTag("forsvar", "forsvar", List.of(), List.of("forsvar"), true));
        defaults.add(new OrgTag("pst", "pst", List.of("pst", "politiets sikkerhetstjeneste"), List.of(), false));
        defaults.add(new OrgTag("nsm", "nsm", List.of("nsm", "nasjonal sikkerhetsmyndighet"), List.of(), false));
        return defaults;
    }

    public static class Search {
        private String baseUrl = "";
        private String sectorParam = "sector";
        private String sectorValue = "state";
        private String openOnlyParam = "open_only";
        private boolean openOnly = true;
        private String pageParam = "page";
        private String queryParam = "q";
        private String query;
        private Map<String, String> extraParams = new LinkedHashMap<>();
        private int startPage = 1;
        private int maxPages = 1;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSectorParam() {
            return sectorParam;
        }

        public void setSectorParam(String sectorParam) {
            this.sectorParam = sectorParam;
        }

        public String getSectorValue() {
            return sectorValue;
        }

        public void setSectorValue(String sectorValue) {
            this.sectorValue = sectorValue;
        }

        public boolean isSectorFilterApplied() {
            return sectorValue != null && !sectorValue.isBlank();
        }

        public String getOpenOnlyParam() {
            return openOnlyParam;
        }

        public void setOpenOnlyParam(String openOnlyParam) {
            this.openOnlyParam = openOnlyParam;
        }

        public boolean isOpenOnly() {
            return openOnly;
        }

        public void setOpenOnly(boolean openOnly) {
            this.openOnly = openOnly;
        }

        public String getPageParam() {
            return pageParam;
        }

        public void setPageParam(String pageParam) {
            this.pageParam = pageParam;
        }

        public String getQueryParam() {
            return queryParam;
        }

        public void setQueryParam(String queryParam) {
            this.queryParam = queryParam;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public Map<String, String> getExtraParams() {
            return extraParams;
        }

        public void setExtraParams(Map<String, String> extraParams) {
            this.extraParams = extraParams == null ? new LinkedHashMap<>() : extraParams;
        }

        public int getStartPage() {
            return Math.max(1, startPage);
        }

        public void setStartPage(int startPage) {
            this.startPage = Math.max(1, startPage);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }
    }

    public static class ListSelectors {
        private String item = ".result-item";
        private String link = "a.result-link";
        private String publishedAt;
        private String updatedAt;
        private List<String> idAttributes = new ArrayList<>(List.of("data-listing-id", "data-id", "data-uuid"));
        private String nextPage;

        public String getItem() {
            return item;
        }

        public void setItem(String item) {
            this.item = item;
        }

        public String getLink() {
            return link;
        }

        public void setLink(String link) {
            this.link = link;
        }

        public String getPublishedAt() {
            return publishedAt;
        }

        public void setPublishedAt(String publishedAt) {
            this.publishedAt = publishedAt;
        }

        public String getUpdatedAt() {
            return updatedAt;
        }

        public void setUpdatedAt(String updatedAt) {
            this.updatedAt = updatedAt;
        }

        public List<String> getIdAttributes() {
            return idAttributes;
        }

        public void setIdAttributes(List<String> idAttributes) {
            this.idAttributes = idAttributes == null ? new ArrayList<>() : idAttributes;
        }

        public String getNextPage() {
            return nextPage;
        }

        public void setNextPage(String nextPage) {
            this.nextPage = nextPage;
        }
    }

    public static class DetailSelectors {
        private String title = "h1.job-title";
        private String jobTitle;
        private String employer = ".employer-name";
        private String locations = ".job-locations";
        private String employmentType = ".employment-type";
        private String extent = ".employment-extent";
        private String salaryText = ".salary";
        private String jobCodeBlocks = ".job-codes";
        private String description;
        private String publishedAt = "time.published";
        private String updatedAt = "time.updated";
        private String applyDeadline = "time.deadline";

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getJobTitle() {
            return jobTitle;
        }

        public void setJobTitle(String jobTitle) {
            this.jobTitle = jobTitle;
        }

        public String getEmployer() {
            return employer;
        }

        public void setEmployer(String employer) {
            this.employer = employer;
        }

        public String getLocations() {
            return locations;
        }

        public void setLocations(String locations) {
            this.locations = locations;
        }

        public String getEmploymentType() {
            return employmentType;
        }

        public void setEmploymentType(String employmentType) {
            this.employmentType = employmentType;
        }

        public String getExtent() {
            return extent;
        }

        public void setExtent(String extent) {
            this.extent = extent;
        }

        public String getSalaryText() {
            return salaryText;
        }

        public void setSalaryText(String salaryText) {
            this.salaryText = salaryText;
        }

        public String getJobCodeBlocks() {
            return jobCodeBlocks;
        }

        public void setJobCodeBlocks(String jobCodeBlocks) {
            this.jobCodeBlocks = jobCodeBlocks;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getPublishedAt() {
            return publishedAt;
        }

        public void setPublishedAt(String publishedAt) {
            this.publishedAt = publishedAt;
        }

        public String getUpdatedAt() {
            return updatedAt;
        }

        public void setUpdatedAt(String updatedAt) {
            this.updatedAt = updatedAt;
        }

        public String getApplyDeadline() {
            return applyDeadline;
        }

        public void setApplyDeadline(String applyDeadline) {
            this.applyDeadline = applyDeadline;
        }
    }

    public static class Identity {
        private List<String> queryIdKeys = new ArrayList<>(List.of("id", "jobId", "job_id", "listingId", "listing_id", "uuid"));
        private List<String> trackingParams = new ArrayList<>(List.of("gclid", "fbclid", "msclkid", "ref", "source"));
        private List<String> trackingParamPrefixes = new ArrayList<>(List.of("utm_"));

        public List<String> getQueryIdKeys() {
            return queryIdKeys;
        }

        public void setQueryIdKeys(List<String> queryIdKeys) {
            this.queryIdKeys = queryIdKeys == null ? new ArrayList<>() : queryIdKeys;
        }

        public List<String> getTrackingParams() {
            return trackingParams;
        }

        public void setTrackingParams(List<String> trackingParams) {
            this.trackingParams = trackingParams == null ? new ArrayList<>() : trackingParams;
        }

        public List<String> getTrackingParamPrefixes() {
            return trackingParamPrefixes;
        }

        public void setTrackingParamPrefixes(List<String> trackingParamPrefixes) {
            this.trackingParamPrefixes = trackingParamPrefixes == null ? new ArrayList<>() : trackingParamPrefixes;
        }
    }

    public static class OrgTag {
        private String tag;
        private String primaryName;
        private List<String> synonyms = new ArrayList<>();
        private List<String> prefixes = new ArrayList<>();
        private boolean titleFallback;

        public OrgTag() {
        }

        public OrgTag(String tag, String primaryName, List<String> synonyms, List<String> prefixes, boolean titleFallback) {
            this.tag = tag;
            this.primaryName = primaryName;
            this.synonyms = new ArrayList<>(synonyms);
            this.prefixes = new ArrayList<>(prefixes);
            this.titleFallback = titleFallback;
        }

        public String getTag() {
            return tag;
        }

        public void setTag(String tag) {
            this.tag = tag;
        }

        public String getPrimaryName() {
            return primaryName;
        }

        public void setPrimaryName(String primaryName) {
            this.primaryName = primaryName;
        }

        public List<String> getSynonyms() {
            return synonyms;
        }

        public void setSynonyms(List<String> synonyms) {
            this.synonyms = synonyms == null ? new ArrayList<>() : synonyms;
        }

        public List<String> getPrefixes() {
            return prefixes;
        }

        public void setPrefixes(List<String> prefixes) {
            this.prefixes = prefixes == null ? new ArrayList<>() : prefixes;
        }

        public boolean isTitleFallback() {
            return titleFallback;
        }

        public void setTitleFallback(boolean titleFallback) {
            this.titleFallback = titleFallback;
        }
    }

    public static class Matching {
        private Double fuzzyThreshold;
        private boolean dropUnmatched = true;

        public Double getFuzzyThreshold() {
            return fuzzyThreshold;
        }

        public void setFuzzyThreshold(Double fuzzyThreshold) {
            if (fuzzyThreshold == null) {
                this.fuzzyThreshold = null;
                return;
            }
            this.fuzzyThreshold = Math.max(0.0, Math.min(1.0, fuzzyThreshold));
        }

        public boolean isDropUnmatched() {
            return dropUnmatched;
        }

        public void setDropUnmatched(boolean dropUnmatched) {
            this.dropUnmatched = dropUnmatched;
        }
    }

    public static class Parsing {
        private List<String> codeKeywords = new ArrayList<>(List.of("stillingskode", "st.kode", "kode", "sko"));
        private List<String> salaryKeywords = new ArrayList<>(List.of(
            "lønn",
            "lønnes",
            "lønnstrinn",
            "lønnsramme",
            "lønnsspenn",
            "lønnstabell",
            "lønnsregulativ",
            "hovedtariffavtale",
            "etter avtale",
            "salary",
            "kr",
            "nok"
        ));

        public List<String> getCodeKeywords() {
            return codeKeywords;
        }

        public void setCodeKeywords(List<String> codeKeywords) {
            this.codeKeywords = codeKeywords == null ? new ArrayList<>() : codeKeywords;
        }

        public List<String> getSalaryKeywords() {
            return salaryKeywords;
        }

        public void setSalaryKeywords(List<String> salaryKeywords) {
            this.salaryKeywords = salaryKeywords == null ? new ArrayList<>() : salaryKeywords;
        }
    }

    public static class Robots {
        private boolean enabled = true;
        private boolean failOpen = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }
    }

    public static class Output {
        private boolean enabled = true;
        private String dir = "data/state-jobs";
        private String explodedFilename = "jobs_exploded";
        private String listingsFilename = "listings";
        private boolean timestampedFiles = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public String getExplodedFilename() {
            return explodedFilename;
        }

        public void setExplodedFilename(String explodedFilename) {
            this.explodedFilename = explodedFilename;
        }

        public String getListingsFilename() {
            return listingsFilename;
        }

        public void setListingsFilename(String listingsFilename) {
            this.listingsFilename = listingsFilename;
        }

        public boolean isTimestampedFiles() {
            return timestampedFiles;
        }

        public void setTimestampedFiles(boolean timestampedFiles) {
            this.timestampedFiles = timestampedFiles;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean fullRefresh;
        private Integer maxPages;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isFullRefresh() {
            return fullRefresh;
        }

        public void setFullRefresh(boolean fullRefresh) {
            this.fullRefresh = fullRefresh;
        }

        public Integer getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(Integer maxPages) {
            this.maxPages = maxPages;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
