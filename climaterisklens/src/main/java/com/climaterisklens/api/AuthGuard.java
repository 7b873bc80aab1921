package com.climaterisklens.api;

import com.climaterisklens.auth.JwtService;
import com.climaterisklens.db.UserRepo.User;
import io.javalin.http.Context;

/**
 * Resolves the bearer token on a request to an active user.
 */
final class AuthGuard {
    private AuthGuard() {
    }

    /**
     * The calling user; 401 when the token is missing, invalid or names an
     * unknown user, 400 when the user is inactive.
     */
    static User requireUser(ApiServer api, Context ctx) throws Exception {
        String header = ctx.header("Authorization");
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            throw new ApiException(401, "not_authenticated", "Not authenticated");
        }
        JwtService.Claims claims = api.svc().jwt().verify(header.substring(7).trim());
        if (claims == null) {
            throw new ApiException(401, "invalid_token", "Could not validate credentials");
        }
        User user = api.svc().users().findById(claims.userId());
        if (user == null) {
            throw new ApiException(401, "invalid_token", "Could not validate credentials");
        }
        if (!user.active()) {
            throw new ApiException(400, "inactive_user", "Inactive user");
        }
        return user;
    }

    static User requireAdmin(ApiServer api, Context ctx) throws Exception {
        User user = requireUser(api, ctx);
        if (!user.isAdmin()) {
            throw new ApiException(403, "forbidden", "Admin access required");
        }
        return user;
    }
}
