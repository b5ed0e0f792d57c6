package peopleops.compensation.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * Employee or manager reference carried in keeper test job payloads.
 *
 * @param id
 *            HR system employee id
 * @param email
 *            work email, used to resolve the messaging platform user
 * @param name
 *            display name
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record JobPersonType(@JsonProperty("id") @NotBlank String id,
        @JsonProperty("email") @NotBlank @Email String email, @JsonProperty("name") String name) {
}
