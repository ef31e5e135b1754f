package com.brandsentinel.core.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts candidate domains from a certificate and keeps those that mention
 * a brand keyword.
 *
 * <p>
 * A domain is discarded when it is a wildcard ({@code *.} prefix), shorter
 * than {@value #MIN_DOMAIN_LENGTH} characters, or contains none of the
 * keywords (case-insensitive substring match). Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class DomainFilter {

    static final int MIN_DOMAIN_LENGTH = 4;
    private static final String DNS_PREFIX = "DNS:";

    private final List<String> keywords;
    private final List<String> lowerKeywords;

    /**
     * @param keywords brand keywords; blank entries are ignored
     */
    public DomainFilter(List<String> keywords) {
        Objects.requireNonNull(keywords, "Keywords must not be null");
        List<String> kept = new ArrayList<>();
        List<String> lowered = new ArrayList<>();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                kept.add(keyword);
                lowered.add(keyword.toLowerCase(Locale.ROOT));
            }
        }
        this.keywords = Collections.unmodifiableList(kept);
        this.lowerKeywords = Collections.unmodifiableList(lowered);
    }

    /**
     * Collect lower-cased domains from the common name and every
     * {@code DNS:} entry of the subject-alternative-name field. Duplicates
     * are collapsed, first occurrence wins.
     *
     * @param commonName     certificate CN, may be empty
     * @param subjectAltName SAN string, e.g. {@code "DNS:a.com, DNS:b.com"}
     * @return candidate domains in certificate order
     */
    public List<String> extractDomains(String commonName, String subjectAltName) {
        Set<String> domains = new LinkedHashSet<>();
        if (commonName != null && !commonName.isBlank()) {
            domains.add(commonName.trim().toLowerCase(Locale.ROOT));
        }
        if (subjectAltName != null && !subjectAltName.isBlank()) {
            for (String part : subjectAltName.split(",")) {
                String entry = part.trim();
                if (entry.startsWith(DNS_PREFIX)) {
                    String domain = entry.substring(DNS_PREFIX.length()).trim();
                    if (!domain.isEmpty()) {
                        domains.add(domain.toLowerCase(Locale.ROOT));
                    }
                }
            }
        }
        return new ArrayList<>(domains);
    }

    /**
     * @param domain lower-cased domain
     * @return {@code true} if the domain should be turned into an event
     */
    public boolean shouldProcess(String domain) {
        return !matchedKeywords(domain).isEmpty();
    }

    /**
     * @param domain candidate domain
     * @return configured keywords (original spelling, configured order) found
     *         in the domain; empty for wildcard or too-short domains
     */
    public List<String> matchedKeywords(String domain) {
        if (domain == null || domain.startsWith("*.") || domain.length() < MIN_DOMAIN_LENGTH) {
            return List.of();
        }
        String lower = domain.toLowerCase(Locale.ROOT);
        List<String> matched = new ArrayList<>();
        for (int i = 0; i < lowerKeywords.size(); i++) {
            if (lower.contains(lowerKeywords.get(i))) {
                matched.add(keywords.get(i));
            }
        }
        return matched;
    }

    public List<String> getKeywords() {
        return keywords;
    }
}
