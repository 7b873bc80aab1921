package com.climaterisklens.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demo-mode mailer: writes the message to the log instead of sending it.
 */
public final class LogMailer implements Mailer {
    private static final Logger log = LoggerFactory.getLogger(LogMailer.class);

    @Override
    public void send(String to, String subject, String body) {
        log.info("DEMO MODE mail to={} subject=\"{}\" body=\"{}\"", to, subject, body);
    }
}
