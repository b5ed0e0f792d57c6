package peopleops.compensation.api.filters;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Rejects unauthenticated calls to {@link SyncEndpointSecured} endpoints with 401.
 *
 * <p>
 * Runs at {@code Priorities.AUTHENTICATION}, so a rejected request never reaches the resource method and has no side
 * effects.
 */
@Provider
@SyncEndpointSecured
@Priority(Priorities.AUTHENTICATION)
public class SyncEndpointAuthFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(SyncEndpointAuthFilter.class);

    @Inject
    SyncEndpointAuthenticator authenticator;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        String header = requestContext.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (authenticator.isAuthorized(header)) {
            return;
        }

        LOG.warnf("Unauthorized request to %s", requestContext.getUriInfo().getPath());
        requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED).type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse("Unauthorized")).build());
    }

    /**
     * Error body for rejected requests.
     */
    public record ErrorResponse(String error) {
    }
}
