package com.climaterisklens.auth;

import com.climaterisklens.cache.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One-time login codes. Each email has at most one pending 6-digit code; a new
 * request replaces it. A code is consumed by a successful check and discarded
 * after too many wrong guesses.
 */
public final class OtpService {
    private static final Logger log = LoggerFactory.getLogger(OtpService.class);

    private final TtlCache<Pending> store;
    private final Mailer mailer;
    private final int maxAttempts;
    private final SecureRandom random = new SecureRandom();

    public OtpService(TtlCache<Pending> store, Mailer mailer, int maxAttempts) {
        this.store = store;
        this.mailer = mailer;
        this.maxAttempts = maxAttempts;
    }

    public int ttlSeconds() {
        return store.ttlSeconds();
    }

    /**
     * Generates, stores and mails a code for the address.
     */
    public void requestCode(String email) throws MailDeliveryException {
        String code = String.valueOf(100000 + random.nextInt(900000));
        Pending pending = new Pending(code);
        store.put(key(email), pending);
        try {
            mailer.send(email, "Climate Risk Lens - Verification Code",
                    "Your Climate Risk Lens verification code is: " + code);
        } catch (MailDeliveryException e) {
            store.remove(key(email), pending);
            throw e;
        }
        log.info("OTP issued for {}", email);
    }

    /**
     * True when the code matches the pending one; the code is then consumed.
     * Every check, right or wrong, uses up one of the allowed attempts, and a
     * code is accepted at most once even under concurrent checks.
     */
    public boolean verify(String email, String code) {
        String key = key(email);
        Pending pending = store.get(key);
        if (pending == null)
            return false;
        int attempt = pending.attempts.incrementAndGet();
        if (attempt > maxAttempts) {
            store.remove(key, pending);
            return false;
        }
        if (code != null && pending.code.equals(code.trim())) {
            return store.remove(key, pending);
        }
        if (attempt == maxAttempts && store.remove(key, pending)) {
            log.warn("OTP for {} discarded after {} failed attempts", email, attempt);
        }
        return false;
    }

    private static String key(String email) {
        return "otp:" + email;
    }

    /**
     * A stored code and the number of checks made against it.
     */
    public static final class Pending {
        private final String code;
        private final AtomicInteger attempts = new AtomicInteger();

        Pending(String code) {
            this.code = code;
        }
    }
}
