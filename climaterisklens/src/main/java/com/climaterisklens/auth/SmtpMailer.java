package com.climaterisklens.auth;

import com.climaterisklens.config.AppConfig;
import com.climaterisklens.metrics.ExternalApiMetrics;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * SMTP mailer using STARTTLS and username/password login.
 */
public final class SmtpMailer implements Mailer {
    private static final Logger log = LoggerFactory.getLogger(SmtpMailer.class);

    private final Session session;
    private final String from;

    public SmtpMailer(AppConfig cfg) {
        Properties props = new Properties();
        props.put("mail.smtp.host", cfg.smtpHost());
        props.put("mail.smtp.port", String.valueOf(cfg.smtpPort()));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "20000");
        String user = cfg.smtpUser();
        String password = cfg.smtpPassword();
        this.session = Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(user, password);
            }
        });
        this.from = cfg.smtpFrom();
    }

    @Override
    public void send(String to, String subject, String body) throws MailDeliveryException {
        try {
            MimeMessage msg = new MimeMessage(session);
            msg.setFrom(new InternetAddress(from));
            msg.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
            msg.setSubject(subject, "US-ASCII");
            msg.setText(body, "US-ASCII");
            Transport.send(msg);
            ExternalApiMetrics.record("SMTP", true);
            log.debug("Mail sent to {}", to);
        } catch (MessagingException e) {
            ExternalApiMetrics.record("SMTP", false);
            throw new MailDeliveryException("SMTP send to " + to + " failed: " + e.getMessage(), e);
        }
    }
}
