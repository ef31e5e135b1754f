package com.brandsentinel.core.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DomainFilter}.
 */
class DomainFilterTest {

    private final DomainFilter filter = new DomainFilter(List.of("PayPal", "amazon"));

    @Test
    @DisplayName("Should extract lower-cased CN and DNS SAN entries")
    void shouldExtractDomains() {
        List<String> domains = filter.extractDomains("PayPal-Secure.com",
                "DNS:paypal-secure.com, DNS:WWW.PayPal-Secure.com, IP Address:1.2.3.4, email:x@y.com");

        assertThat(domains).containsExactly("paypal-secure.com", "www.paypal-secure.com");
    }

    @Test
    @DisplayName("Should tolerate an empty common name and SAN")
    void shouldHandleEmptyFields() {
        assertThat(filter.extractDomains("", "")).isEmpty();
        assertThat(filter.extractDomains(null, "DNS:amazon-deals.net")).containsExactly("amazon-deals.net");
    }

    @Test
    @DisplayName("Should never process wildcard domains")
    void shouldRejectWildcards() {
        assertThat(filter.shouldProcess("*.paypal.com")).isFalse();
    }

    @Test
    @DisplayName("Should never process domains shorter than four characters")
    void shouldRejectShortDomains() {
        DomainFilter shortKeyword = new DomainFilter(List.of("a"));

        assertThat(shortKeyword.shouldProcess("a.b")).isFalse();
        assertThat(shortKeyword.shouldProcess("a.bc")).isTrue();
    }

    @Test
    @DisplayName("Should keep only domains containing a keyword")
    void shouldMatchKeywordsCaseInsensitively() {
        assertThat(filter.shouldProcess("paypal-secure.com")).isTrue();
        assertThat(filter.shouldProcess("example.com")).isFalse();
        assertThat(filter.matchedKeywords("paypal-amazon-login.com")).containsExactly("PayPal", "amazon");
    }

    @Test
    @DisplayName("Should ignore blank keywords")
    void shouldIgnoreBlankKeywords() {
        DomainFilter blank = new DomainFilter(List.of(" ", "", "apple"));

        assertThat(blank.getKeywords()).containsExactly("apple");
        assertThat(blank.shouldProcess("example.com")).isFalse();
    }
}
