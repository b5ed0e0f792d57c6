package peopleops.compensation.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body of {@code POST /api/jobs/run}.
 *
 * @param success
 *            false only when the cycle itself failed (claim could not run)
 * @param results
 *            one entry per dispatched job
 * @param error
 *            cycle failure message
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRunResponseType(@JsonProperty("success") boolean success,
        @JsonProperty("results") List<JobResultType> results, @JsonProperty("error") String error) {

    public static JobRunResponseType completed(List<JobResultType> results) {
        return new JobRunResponseType(true, results, null);
    }

    public static JobRunResponseType failed(String error) {
        return new JobRunResponseType(false, null, error);
    }
}
