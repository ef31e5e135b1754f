package com.brandsentinel.core.enforcement;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Transport;

/**
 * Delivers a composed message. The default delegates to
 * {@link Transport#send(Message)}.
 */
@FunctionalInterface
public interface MailTransport {

    MailTransport SMTP = Transport::send;

    void send(Message message) throws MessagingException;
}
