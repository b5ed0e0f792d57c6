package peopleops.compensation.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.UUID;

/**
 * Outcome of one job within a trigger invocation.
 *
 * @param id
 *            job id
 * @param success
 *            whether the handler succeeded and the outcome was committed
 * @param data
 *            applied update on success ({@code queue_name}, {@code scheduled}), failure details otherwise
 *            ({@code failure_count}, {@code dead_lettered}, {@code commit_error})
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResultType(@JsonProperty("id") UUID id, @JsonProperty("success") boolean success,
        @JsonProperty("data") Map<String, Object> data) {
}
