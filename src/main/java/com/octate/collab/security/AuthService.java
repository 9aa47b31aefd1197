package com.octate.collab.security;

import com.octate.collab.config.CollabConfig;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

/**
 * Validates {@code auth} frames. A bearer token must verify and name the claimed
 * user as its subject; a frame without a token is admitted only when anonymous
 * access is enabled.
 */
@ApplicationScoped
public class AuthService {

    private static final Logger LOG = Logger.getLogger(AuthService.class);

    public record AuthResult(boolean authenticated, String userId, String reason) {

        static AuthResult ok(String userId) {
            return new AuthResult(true, userId, null);
        }

        static AuthResult denied(String reason) {
            return new AuthResult(false, null, reason);
        }
    }

    private final JWTParser parser;
    private final boolean allowAnonymous;

    @Inject
    public AuthService(JWTParser parser, CollabConfig config) {
        this(parser, config.auth().allowAnonymous());
    }

    public AuthService(JWTParser parser, boolean allowAnonymous) {
        this.parser = parser;
        this.allowAnonymous = allowAnonymous;
    }

    public AuthResult authenticate(String userId, String token) {
        if (userId == null || userId.isBlank()) {
            return AuthResult.denied("Missing userId");
        }
        if (token == null || token.isBlank()) {
            return allowAnonymous
                ? AuthResult.ok(userId)
                : AuthResult.denied("Authentication required");
        }
        try {
            JsonWebToken jwt = parser.parse(stripBearer(token));
            if (!userId.equals(jwt.getSubject())) {
                LOG.warnf("Token subject %s does not match claimed user %s", jwt.getSubject(), userId);
                return AuthResult.denied("Token does not match user");
            }
            return AuthResult.ok(userId);
        } catch (ParseException e) {
            LOG.debugf("Rejected token for %s: %s", userId, e.getMessage());
            return AuthResult.denied("Invalid token");
        }
    }

    private static String stripBearer(String token) {
        return token.regionMatches(true, 0, "Bearer ", 0, 7) ? token.substring(7).trim() : token;
    }
}
