package com.brandsentinel.core.config;

import com.brandsentinel.core.pipeline.EventQueue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Top-level POJO for the YAML configuration.
 *
 * <p>
 * Expected YAML structure (abridged):
 * </p>
 *
 * <pre>
 * monitoring:
 *   sources:
 *     certstream:
 *       enabled: true
 *       keywords: [paypal, amazon]
 * enrichment:
 *   htmlContent: { enabled: true, timeout: 10s }
 *   favicon: { enabled: true, timeout: 5s }
 * rules:
 *   faviconSimilarity:
 *     enabled: true
 *     threshold: 0.85
 *     referenceFavicons: { paypal: "https://www.paypal.com/favicon.ico" }
 * enforcement:
 *   logger: { enabled: true }
 *   emailAbuse: { enabled: false }
 * storage: { type: memory }
 * logging: { level: info }
 * dryRun: false
 * </pre>
 *
 * <p>
 * {@link ConfigLoader} calls {@link #applyDefaults()} and {@link #validate()}
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig {

    static final Set<String> STORAGE_TYPES = Set.of("memory", "sqlite", "postgres");
    static final Set<String> LOG_LEVELS = Set.of("debug", "info", "warn", "error");

    private MonitoringConfig monitoring = new MonitoringConfig();
    private EnrichmentConfig enrichment = new EnrichmentConfig();
    private RulesConfig rules = new RulesConfig();
    private EnforcementConfig enforcement = new EnforcementConfig();
    private StorageConfig storage = new StorageConfig();
    private LoggingConfig logging = new LoggingConfig();
    private EngineConfig engine = new EngineConfig();
    private boolean dryRun;

    // ---------------------------------------------------------------
    // Defaults and validation
    // ---------------------------------------------------------------

    /**
     * Fill in every value left empty in the YAML file.
     */
    public void applyDefaults() {
        if (monitoring == null) monitoring = new MonitoringConfig();
        if (monitoring.getSources() == null) monitoring.setSources(new SourcesConfig());
        if (monitoring.getSources().getCertstream() == null) {
            monitoring.getSources().setCertstream(new CertstreamConfig());
        }
        if (enrichment == null) enrichment = new EnrichmentConfig();
        if (enrichment.getHtmlContent() == null) enrichment.setHtmlContent(new HtmlContentConfig());
        if (enrichment.getFavicon() == null) enrichment.setFavicon(new FaviconConfig());
        if (rules == null) rules = new RulesConfig();
        if (rules.getFaviconSimilarity() == null) rules.setFaviconSimilarity(new FaviconSimilarityConfig());
        if (enforcement == null) enforcement = new EnforcementConfig();
        if (enforcement.getEmailAbuse() == null) enforcement.setEmailAbuse(new EmailAbuseConfig());
        if (enforcement.getEmailAbuse().getSmtp() == null) enforcement.getEmailAbuse().setSmtp(new SmtpConfig());
        if (enforcement.getLogger() == null) enforcement.setLogger(new LoggerConfig());
        if (storage == null) storage = new StorageConfig();
        if (logging == null) logging = new LoggingConfig();
        if (engine == null) engine = new EngineConfig();

        CertstreamConfig certstream = monitoring.getSources().getCertstream();
        if (isBlank(certstream.getUrl())) {
            certstream.setUrl(CertstreamConfig.DEFAULT_URL);
        }
        if (certstream.getKeywords() == null) {
            certstream.setKeywords(new ArrayList<>());
        }

        HtmlContentConfig html = enrichment.getHtmlContent();
        if (isBlank(html.getTimeout())) html.setTimeout("10s");
        if (isBlank(html.getUserAgent())) html.setUserAgent("BrandSentinel/1.0");
        if (isBlank(html.getUrlTemplate())) html.setUrlTemplate("https://%s/");

        FaviconConfig favicon = enrichment.getFavicon();
        if (isBlank(favicon.getTimeout())) favicon.setTimeout("5s");
        if (isBlank(favicon.getUrlTemplate())) favicon.setUrlTemplate("https://%s/favicon.ico");

        FaviconSimilarityConfig similarity = rules.getFaviconSimilarity();
        if (similarity.getThreshold() == 0) similarity.setThreshold(0.85);
        if (similarity.getReferenceFavicons() == null) similarity.setReferenceFavicons(new LinkedHashMap<>());

        if (enforcement.getEmailAbuse().getSmtp().getPort() == 0) {
            enforcement.getEmailAbuse().getSmtp().setPort(587);
        }

        if (isBlank(storage.getType())) storage.setType("memory");
        if (isBlank(logging.getLevel())) logging.setLevel("info");

        if (engine.getQueueCapacity() == 0) engine.setQueueCapacity(EventQueue.DEFAULT_CAPACITY);
        if (isBlank(engine.getStatsInterval())) engine.setStatsInterval("30s");
    }

    /**
     * Validate the whole configuration, collecting every problem before
     * failing.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        String storageType = storage.getType() == null ? "" : storage.getType().toLowerCase(Locale.ROOT);
        if (!STORAGE_TYPES.contains(storageType)) {
            errors.add("Invalid storage type: '" + storage.getType() + "' (must be: memory, sqlite, postgres)");
        }

        String level = logging.getLevel() == null ? "" : logging.getLevel().toLowerCase(Locale.ROOT);
        if (!LOG_LEVELS.contains(level)) {
            errors.add("Invalid log level: '" + logging.getLevel() + "' (must be: debug, info, warn, error)");
        }

        CertstreamConfig certstream = monitoring.getSources().getCertstream();
        if (certstream.isEnabled()) {
            if (isBlank(certstream.getUrl())) {
                errors.add("Certstream 'url' is required when certstream is enabled");
            }
            if (certstream.getKeywords().stream().allMatch(SentinelConfig::isBlank)) {
                errors.add("Certstream requires at least one non-blank keyword");
            }
        }

        requireDuration(errors, "enrichment.htmlContent.timeout", enrichment.getHtmlContent().getTimeout());
        requireDuration(errors, "enrichment.favicon.timeout", enrichment.getFavicon().getTimeout());
        requireDuration(errors, "engine.statsInterval", engine.getStatsInterval());

        FaviconSimilarityConfig similarity = rules.getFaviconSimilarity();
        if (similarity.isEnabled()
                && (similarity.getThreshold() < 0 || similarity.getThreshold() > 1)) {
            errors.add("Favicon similarity threshold must be between 0 and 1, got: "
                    + similarity.getThreshold());
        }

        EmailAbuseConfig email = enforcement.getEmailAbuse();
        if (email.isEnabled()) {
            if (isBlank(email.getSmtp().getHost())) {
                errors.add("SMTP host is required when email enforcement is enabled");
            }
            if (isBlank(email.getFrom())) {
                errors.add("Email 'from' address is required when email enforcement is enabled");
            }
            int port = email.getSmtp().getPort();
            if (port < 1 || port > 65_535) {
                errors.add("SMTP port must be in [1, 65535], got: " + port);
            }
        }

        if (engine.getQueueCapacity() < 1) {
            errors.add("engine.queueCapacity must be >= 1, got: " + engine.getQueueCapacity());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    private static void requireDuration(List<String> errors, String name, String value) {
        if (!Durations.isValid(value)) {
            errors.add("Invalid duration for '" + name + "': '" + value + "'");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public MonitoringConfig getMonitoring() {
        return monitoring;
    }

    public void setMonitoring(MonitoringConfig monitoring) {
        this.monitoring = monitoring;
    }

    public EnrichmentConfig getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(EnrichmentConfig enrichment) {
        this.enrichment = enrichment;
    }

    public RulesConfig getRules() {
        return rules;
    }

    public void setRules(RulesConfig rules) {
        this.rules = rules;
    }

    public EnforcementConfig getEnforcement() {
        return enforcement;
    }

    public void setEnforcement(EnforcementConfig enforcement) {
        this.enforcement = enforcement;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage;
    }

    public LoggingConfig getLogging() {
        return logging;
    }

    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }

    public EngineConfig getEngine() {
        return engine;
    }

    public void setEngine(EngineConfig engine) {
        this.engine = engine;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "certstream=" + monitoring.getSources().getCertstream() +
                ", storage=" + storage.getType() +
                ", logLevel=" + logging.getLevel() +
                ", dryRun=" + dryRun +
                '}';
    }

    // ===============================================================
    // Nested sections
    // ===============================================================

    public static class MonitoringConfig {
        private SourcesConfig sources = new SourcesConfig();

        public SourcesConfig getSources() {
            return sources;
        }

        public void setSources(SourcesConfig sources) {
            this.sources = sources;
        }
    }

    public static class SourcesConfig {
        private CertstreamConfig certstream = new CertstreamConfig();

        public CertstreamConfig getCertstream() {
            return certstream;
        }

        public void setCertstream(CertstreamConfig certstream) {
            this.certstream = certstream;
        }
    }

    public static class CertstreamConfig {
        static final String DEFAULT_URL = "wss://certstream.calidog.io/";

        private boolean enabled;
        private String url;
        private List<String> keywords = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords != null ? new ArrayList<>(keywords) : new ArrayList<>();
        }

        @Override
        public String toString() {
            return "{enabled=" + enabled + ", url='" + url + "', keywords=" + keywords + '}';
        }
    }

    public static class EnrichmentConfig {
        private HtmlContentConfig htmlContent = new HtmlContentConfig();
        private FaviconConfig favicon = new FaviconConfig();

        public HtmlContentConfig getHtmlContent() {
            return htmlContent;
        }

        public void setHtmlContent(HtmlContentConfig htmlContent) {
            this.htmlContent = htmlContent;
        }

        public FaviconConfig getFavicon() {
            return favicon;
        }

        public void setFavicon(FaviconConfig favicon) {
            this.favicon = favicon;
        }
    }

    public static class HtmlContentConfig {
        private boolean enabled;
        private String timeout;
        private String userAgent;
        /** {@link String#format} template receiving the domain. */
        private String urlTemplate;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTimeout() {
            return timeout;
        }

        public void setTimeout(String timeout) {
            this.timeout = timeout;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }
    }

    public static class FaviconConfig {
        private boolean enabled;
        private String timeout;
        /** {@link String#format} template receiving the domain. */
        private String urlTemplate;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTimeout() {
            return timeout;
        }

        public void setTimeout(String timeout) {
            this.timeout = timeout;
        }

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }
    }

    public static class RulesConfig {
        private FaviconSimilarityConfig faviconSimilarity = new FaviconSimilarityConfig();

        public FaviconSimilarityConfig getFaviconSimilarity() {
            return faviconSimilarity;
        }

        public void setFaviconSimilarity(FaviconSimilarityConfig faviconSimilarity) {
            this.faviconSimilarity = faviconSimilarity;
        }
    }

    public static class FaviconSimilarityConfig {
        private boolean enabled;
        private double threshold;
        /** Brand keyword to reference favicon URL. */
        private Map<String, String> referenceFavicons = new LinkedHashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public Map<String, String> getReferenceFavicons() {
            return referenceFavicons;
        }

        public void setReferenceFavicons(Map<String, String> referenceFavicons) {
            this.referenceFavicons = referenceFavicons != null
                    ? new LinkedHashMap<>(referenceFavicons)
                    : new LinkedHashMap<>();
        }
    }

    public static class EnforcementConfig {
        private EmailAbuseConfig emailAbuse = new EmailAbuseConfig();
        private LoggerConfig logger = new LoggerConfig();

        public EmailAbuseConfig getEmailAbuse() {
            return emailAbuse;
        }

        public void setEmailAbuse(EmailAbuseConfig emailAbuse) {
            this.emailAbuse = emailAbuse;
        }

        public LoggerConfig getLogger() {
            return logger;
        }

        public void setLogger(LoggerConfig logger) {
            this.logger = logger;
        }
    }

    public static class EmailAbuseConfig {
        private boolean enabled;
        private SmtpConfig smtp = new SmtpConfig();
        private String from;
        /** Fixed recipient; when empty, reports go to {@code abuse@<domain>}. */
        private String recipient;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public SmtpConfig getSmtp() {
            return smtp;
        }

        public void setSmtp(SmtpConfig smtp) {
            this.smtp = smtp;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getRecipient() {
            return recipient;
        }

        public void setRecipient(String recipient) {
            this.recipient = recipient;
        }
    }

    public static class SmtpConfig {
        private String host;
        private int port;
        private String username;
        private String password;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    public static class LoggerConfig {
        private boolean enabled;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class StorageConfig {
        /** memory, sqlite or postgres. */
        private String type;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class LoggingConfig {
        /** debug, info, warn or error. */
        private String level;

        public String getLevel() {
            return level;
        }

        public void setLevel(String level) {
            this.level = level;
        }
    }

    public static class EngineConfig {
        private int queueCapacity;
        private String statsInterval;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getStatsInterval() {
            return statsInterval;
        }

        public void setStatsInterval(String statsInterval) {
            this.statsInterval = statsInterval;
        }
    }
}
