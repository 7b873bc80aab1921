package com.climaterisklens.alerts;

import com.climaterisklens.auth.MailDeliveryException;
import com.climaterisklens.auth.Mailer;
import com.climaterisklens.db.AlertRepo;
import com.climaterisklens.db.AlertRepo.Alert;
import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.HazardRepo.Prediction;
import com.climaterisklens.db.JobRunRepo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Checks pending alert rows against the latest prediction for their site cell
 * and delivers the ones at or above threshold. A delivered row becomes sent, a
 * delivery failure becomes failed, rows below threshold stay pending.
 */
public class AlertProcessor {
    private static final Logger log = LoggerFactory.getLogger(AlertProcessor.class);
    static final int BATCH_LIMIT = 500;

    private final AlertRepo alertRepo;
    private final HazardRepo hazardRepo;
    private final JobRunRepo jobRunRepo;
    private final Mailer mailer;
    private final WebhookNotifier webhooks;
    private final ObjectMapper om;
    private final int horizonMinutes;
    private final Clock clock;

    public AlertProcessor(AlertRepo alertRepo, HazardRepo hazardRepo, JobRunRepo jobRunRepo, Mailer mailer,
            WebhookNotifier webhooks, ObjectMapper om, int horizonHours, Clock clock) {
        this.alertRepo = alertRepo;
        this.hazardRepo = hazardRepo;
        this.jobRunRepo = jobRunRepo;
        this.mailer = mailer;
        this.webhooks = webhooks;
        this.om = om;
        this.horizonMinutes = horizonHours * 60;
        this.clock = clock;
    }

    public Result processPending() throws Exception {
        log.info("Starting job: processAlerts");
        UUID runId = jobRunRepo.startRun("alerts");
        MDC.put("runId", runId.toString());
        int sent = 0;
        int failed = 0;
        int waiting = 0;
        int errors = 0;
        try {
            List<Alert> pending = alertRepo.pending(BATCH_LIMIT);
            for (Alert a : pending) {
                try {
                    Prediction p = hazardRepo.latest(a.hazardType(), a.gridId(), horizonMinutes);
                    if (p == null) {
                        waiting++;
                        continue;
                    }
                    if (p.pRisk() < a.threshold()) {
                        alertRepo.updateRisk(a.id(), p.pRisk());
                        waiting++;
                        continue;
                    }
                    if (deliver(a, p)) {
                        alertRepo.markSent(a.id(), p.pRisk(), clock.instant());
                        sent++;
                    } else {
                        alertRepo.markFailed(a.id(), p.pRisk());
                        failed++;
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ie;
                } catch (Exception e) {
                    errors++;
                    log.warn("Alert {} not processed: {}", a.id(), e.getMessage());
                }
            }
            Result r = new Result(pending.size(), sent, failed, waiting, errors);
            jobRunRepo.finishRun(runId, errors == 0, r.toString());
            log.info("Finished processAlerts: {}", r);
            return r;
        } catch (Exception outer) {
            jobRunRepo.finishRun(runId, false, "fatal: " + outer.getMessage());
            throw outer;
        } finally {
            MDC.remove("runId");
        }
    }

    private boolean deliver(Alert a, Prediction p) throws InterruptedException {
        if ("webhook".equals(a.channel())) {
            if (a.webhookUrl() == null || a.webhookUrl().isBlank())
                return false;
            return webhooks.send(a.webhookUrl(), payload(a, p));
        }
        if ("email".equals(a.channel())) {
            if (a.recipientEmail() == null || a.recipientEmail().isBlank())
                return false;
            try {
                mailer.send(a.recipientEmail(), subject(a), emailBody(a, p));
                return true;
            } catch (MailDeliveryException e) {
                log.warn("Alert email to {} failed: {}", a.recipientEmail(), e.getMessage());
                return false;
            }
        }
        log.warn("Alert {} has unknown channel {}", a.id(), a.channel());
        return false;
    }

    ObjectNode payload(Alert a, Prediction p) {
        ObjectNode n = om.createObjectNode();
        n.put("alert_id", a.id().toString());
        n.put("subscription_id", a.subscriptionId().toString());
        n.put("site_id", a.siteId().toString());
        n.put("site_name", a.siteName());
        n.put("hazard", a.hazardType());
        n.put("p_risk", p.pRisk());
        n.put("threshold", a.threshold());
        n.put("grid_id", a.gridId());
        n.put("model_version", p.modelVersion());
        n.put("issued_at", String.valueOf(p.issuedAt()));
        n.put("message", message(a, p));
        return n;
    }

    private static String subject(Alert a) {
        return "Climate Risk Lens alert: " + a.hazardType() + " at " + a.siteName();
    }

    private static String emailBody(Alert a, Prediction p) {
        return message(a, p) + "\nModel: " + p.modelVersion() + "\nIssued: " + p.issuedAt();
    }

    private static String message(Alert a, Prediction p) {
        return String.format(Locale.ROOT, "%s risk at %s is %.1f%% (threshold %.1f%%).",
                a.hazardType(), a.siteName(), p.pRisk() * 100.0, a.threshold() * 100.0);
    }

    /**
     * Counts from one pass: rows seen, delivered, failed, left pending, and
     * rows skipped because of an error.
     */
    public record Result(int processed, int sent, int failed, int waiting, int errors) {
        @Override
        public String toString() {
            return "processed=" + processed + " sent=" + sent + " failed=" + failed + " waiting=" + waiting
                    + " errors=" + errors;
        }
    }
}
