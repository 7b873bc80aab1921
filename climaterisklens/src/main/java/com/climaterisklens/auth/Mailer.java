package com.climaterisklens.auth;

import com.climaterisklens.config.AppConfig;

/**
 * Outbound plain-text mail (OTP codes and email alerts).
 */
public interface Mailer {

    void send(String to, String subject, String body) throws MailDeliveryException;

    /**
     * SMTP delivery when a host and user are configured, otherwise a mailer
     * that only logs (demo mode).
     */
    static Mailer fromConfig(AppConfig cfg) {
        if (cfg.smtpConfigured())
            return new SmtpMailer(cfg);
        return new LogMailer();
    }
}
