package peopleops.compensation.api.filters;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Verifies the shared key presented to the job trigger endpoints.
 *
 * <p>
 * The key arrives as a bearer token, or as a {@code token} query parameter from callers that cannot set headers
 * (Slack interaction callbacks). It must equal {@code compensation.sync-endpoint-key}. The comparison is constant-time. When no key is
 * configured every request is rejected.
 */
@ApplicationScoped
public class SyncEndpointAuthenticator {

    private static final Logger LOG = Logger.getLogger(SyncEndpointAuthenticator.class);

    private static final String BEARER_PREFIX = "Bearer ";

    @ConfigProperty(
            name = "compensation.sync-endpoint-key",
            defaultValue = "")
    String syncEndpointKey;

    /**
     * Checks an {@code Authorization} header value.
     *
     * @param authorizationHeader
     *            raw header, may be null
     * @return true if it carries the configured key
     */
    public boolean isAuthorized(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return false;
        }
        return isValidToken(authorizationHeader.substring(BEARER_PREFIX.length()).trim());
    }

    /**
     * Checks a bare token.
     *
     * @param token
     *            token value, may be null
     * @return true if it equals the configured key
     */
    public boolean isValidToken(String token) {
        if (syncEndpointKey == null || syncEndpointKey.isBlank()) {
            LOG.warn("compensation.sync-endpoint-key is not configured, rejecting request");
            return false;
        }
        if (token == null || token.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8),
                syncEndpointKey.getBytes(StandardCharsets.UTF_8));
    }
}
