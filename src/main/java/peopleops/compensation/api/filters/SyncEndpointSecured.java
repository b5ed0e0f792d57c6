package peopleops.compensation.api.filters;

import jakarta.ws.rs.NameBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks endpoints callable only with the shared sync endpoint key as a bearer token.
 *
 * <p>
 * Requests without {@code Authorization: Bearer <compensation.sync-endpoint-key>} are rejected with 401 before the
 * resource method runs.
 *
 * @see SyncEndpointAuthFilter for enforcement
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface SyncEndpointSecured {
}
