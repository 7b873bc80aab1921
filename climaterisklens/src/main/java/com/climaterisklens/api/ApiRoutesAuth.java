package com.climaterisklens.api;

import com.climaterisklens.auth.MailDeliveryException;
import com.climaterisklens.db.UserRepo.User;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Passwordless login: a one-time code by mail, exchanged for a JWT.
 */
final class ApiRoutesAuth {
    private static final Logger log = LoggerFactory.getLogger(ApiRoutesAuth.class);
    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private ApiRoutesAuth() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppServices svc = api.svc();

        app.post(ApiServer.API + "/auth/request_otp", ctx -> {
            String email = email(ApiServer.text(api.jsonBody(ctx), "email"));
            try {
                svc.otp().requestCode(email);
            } catch (MailDeliveryException e) {
                log.error("Could not send login code to {}", email, e);
                throw new ApiException(500, "otp_send_failed", "Failed to send verification code");
            }
            ctx.json(om.createObjectNode()
                    .put("message", "Verification code sent to your email")
                    .put("email", email)
                    .put("expires_in", svc.otp().ttlSeconds()));
        });

        app.post(ApiServer.API + "/auth/verify_otp", ctx -> {
            ObjectNode body = api.jsonBody(ctx);
            String email = email(ApiServer.text(body, "email"));
            String code = ApiServer.text(body, "code");
            if (code == null || !svc.otp().verify(email, code)) {
                throw new ApiException(401, "invalid_code", "Invalid or expired verification code");
            }
            User user = svc.users().upsertVerified(email);
            log.info("User {} logged in", user.id());
            ctx.json(om.createObjectNode()
                    .put("access_token", svc.jwt().issue(user))
                    .put("token_type", "bearer")
                    .put("expires_in", svc.jwt().expiresInSeconds()));
        });

        app.get(ApiServer.API + "/auth/me", ctx -> {
            User user = AuthGuard.requireUser(api, ctx);
            ObjectNode out = om.createObjectNode();
            out.put("id", user.id().toString());
            out.put("email", user.email());
            out.put("role", user.role());
            if (user.orgId() == null)
                out.putNull("org_id");
            else
                out.put("org_id", user.orgId().toString());
            out.put("is_verified", user.verified());
            ctx.json(out);
        });
    }

    static String email(String raw) {
        if (raw == null || !EMAIL.matcher(raw).matches()) {
            throw ApiException.badRequest("invalid_email", "A valid email address is required");
        }
        return raw.toLowerCase(Locale.ROOT);
    }
}
