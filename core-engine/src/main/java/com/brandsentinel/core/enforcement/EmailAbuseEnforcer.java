package com.brandsentinel.core.enforcement;

import com.brandsentinel.core.config.SentinelConfig;
import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.pipeline.Enforcer;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import com.brandsentinel.core.pipeline.StageException;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Sends an abuse report by email for every threat.
 *
 * <p>
 * The report goes to the configured recipient, or to {@code abuse@<domain>}
 * when none is configured. SMTP uses STARTTLS and authenticates when a
 * username is set. In dry-run mode the message is composed and logged but
 * never handed to the transport.
 * </p>
 *
 * @since 1.0.0
 */
public class EmailAbuseEnforcer implements Enforcer {

    private static final Logger LOG = LoggerFactory.getLogger(EmailAbuseEnforcer.class);

    public static final String NAME = "email_abuse";

    static final int DEFAULT_SMTP_PORT = 587;
    private static final String TIMEOUT_MILLIS = "10000";

    private final Session session;
    private final String from;
    private final String recipient;
    private final MailTransport transport;

    public EmailAbuseEnforcer(SentinelConfig.EmailAbuseConfig config) {
        this(config, MailTransport.SMTP);
    }

    /**
     * @param config    SMTP and addressing settings
     * @param transport message delivery
     * @throws IllegalArgumentException if host or from-address is missing
     */
    public EmailAbuseEnforcer(SentinelConfig.EmailAbuseConfig config, MailTransport transport) {
        Objects.requireNonNull(config, "Email config must not be null");
        this.transport = Objects.requireNonNull(transport, "Transport must not be null");
        SentinelConfig.SmtpConfig smtp = config.getSmtp();
        if (smtp == null || isBlank(smtp.getHost())) {
            throw new IllegalArgumentException("Email abuse enforcer requires an SMTP host");
        }
        if (isBlank(config.getFrom())) {
            throw new IllegalArgumentException("Email abuse enforcer requires a from address");
        }
        this.from = config.getFrom();
        this.recipient = isBlank(config.getRecipient()) ? null : config.getRecipient();
        this.session = createSession(smtp);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void enforce(ShutdownSignal signal, DetectionResult result, boolean dryRun) throws StageException {
        String to = recipientFor(result.getDomain());
        MimeMessage message;
        try {
            message = compose(result, to);
        } catch (MessagingException e) {
            throw new StageException("Failed to compose abuse report for " + result.getDomain()
                    + ": " + e.getMessage(), e);
        }

        if (dryRun) {
            LOG.info("[DRY-RUN] Would send abuse report for {} to {}", result.getDomain(), to);
            return;
        }
        try {
            transport.send(message);
        } catch (MessagingException e) {
            throw new StageException("Failed to send abuse report to " + to + ": " + e.getMessage(), e);
        }
        LOG.info("Sent abuse report for {} to {}", result.getDomain(), to);
    }

    String recipientFor(String domain) {
        return recipient != null ? recipient : "abuse@" + domain;
    }

    MimeMessage compose(DetectionResult result, String to) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(from));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
        message.setSubject(subject(result), StandardCharsets.UTF_8.name());
        message.setText(body(result), StandardCharsets.UTF_8.name());
        message.setSentDate(Date.from(result.getDetectedAt()));
        return message;
    }

    static String subject(DetectionResult result) {
        String brand = result.getBrand() != null ? result.getBrand() : "a protected brand";
        return "Abuse report: " + result.getDomain() + " impersonating " + brand;
    }

    static String body(DetectionResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Hello,\n\n")
                .append("We detected a domain that appears to impersonate ")
                .append(result.getBrand() != null ? result.getBrand() : "a protected brand")
                .append(".\n\n")
                .append("Domain:      ").append(result.getDomain()).append('\n')
                .append("Rule:        ").append(result.getRule()).append('\n')
                .append("Confidence:  ").append(String.format(Locale.ROOT, "%.2f", result.getConfidence())).append('\n')
                .append("Detected at: ").append(result.getDetectedAt()).append('\n');
        if (!result.getMetadata().isEmpty()) {
            sb.append("\nEvidence:\n");
            result.getMetadata().forEach((key, value) ->
                    sb.append("  ").append(key).append(": ").append(value).append('\n'));
        }
        sb.append("\nPlease investigate and take the site down if it is confirmed malicious.\n\n")
                .append("-- Brand Sentinel\n");
        return sb.toString();
    }

    private static Session createSession(SentinelConfig.SmtpConfig smtp) {
        int port = smtp.getPort() > 0 ? smtp.getPort() : DEFAULT_SMTP_PORT;
        Properties props = new Properties();
        props.put("mail.smtp.host", smtp.getHost());
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.connectiontimeout", TIMEOUT_MILLIS);
        props.put("mail.smtp.timeout", TIMEOUT_MILLIS);
        props.put("mail.smtp.writetimeout", TIMEOUT_MILLIS);

        if (isBlank(smtp.getUsername())) {
            return Session.getInstance(props);
        }
        props.put("mail.smtp.auth", "true");
        String username = smtp.getUsername();
        String password = smtp.getPassword() != null ? smtp.getPassword() : "";
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
