package com.brandsentinel.core.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One JSON message from the certstream feed.
 *
 * <pre>
 * {"message_type": "certificate_update",
 *  "data": {"update_type": "X509LogEntry",
 *           "leaf_cert": {"subject": {"CN": "..."},
 *                         "extensions": {"subjectAltName": "DNS:a.com, DNS:b.com"}}}}
 * </pre>
 *
 * <p>
 * Only the fields the pipeline needs are mapped; everything else is ignored.
 * Missing sections decode to empty strings.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CertstreamMessage {

    /** Message type carrying a new certificate. */
    public static final String CERTIFICATE_UPDATE = "certificate_update";

    @JsonProperty("message_type")
    private String messageType;

    @JsonProperty("data")
    private Data data;

    public String getMessageType() {
        return messageType;
    }

    public boolean isCertificateUpdate() {
        return CERTIFICATE_UPDATE.equals(messageType);
    }

    public String updateType() {
        return data != null && data.updateType != null ? data.updateType : "";
    }

    public String commonName() {
        if (data == null || data.leafCert == null || data.leafCert.subject == null) {
            return "";
        }
        String cn = data.leafCert.subject.commonName;
        return cn != null ? cn : "";
    }

    public String subjectAltName() {
        if (data == null || data.leafCert == null || data.leafCert.extensions == null) {
            return "";
        }
        String san = data.leafCert.extensions.subjectAltName;
        return san != null ? san : "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Data {
        @JsonProperty("update_type")
        String updateType;

        @JsonProperty("leaf_cert")
        LeafCert leafCert;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LeafCert {
        @JsonProperty("subject")
        Subject subject;

        @JsonProperty("extensions")
        Extensions extensions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Subject {
        @JsonProperty("CN")
        String commonName;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Extensions {
        @JsonProperty("subjectAltName")
        String subjectAltName;
    }
}
