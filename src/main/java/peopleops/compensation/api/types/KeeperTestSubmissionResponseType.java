package peopleops.compensation.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body of the keeper test interaction endpoint.
 *
 * @param success
 *            false when required answers are missing or the request was malformed
 * @param invalidFields
 *            action ids of unanswered required questions
 * @param error
 *            message for malformed requests
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeeperTestSubmissionResponseType(@JsonProperty("success") boolean success,
        @JsonProperty("invalid_fields") List<String> invalidFields, @JsonProperty("error") String error) {

    public static KeeperTestSubmissionResponseType accepted() {
        return new KeeperTestSubmissionResponseType(true, null, null);
    }

    public static KeeperTestSubmissionResponseType incomplete(List<String> invalidFields) {
        return new KeeperTestSubmissionResponseType(false, invalidFields, null);
    }

    public static KeeperTestSubmissionResponseType error(String error) {
        return new KeeperTestSubmissionResponseType(false, null, error);
    }
}
