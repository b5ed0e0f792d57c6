package peopleops.compensation.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Set;

/**
 * Payload of {@code send_keeper_test} and {@code receive_keeper_test_results} jobs.
 *
 * <p>
 * Also the request body of {@code POST /api/jobs/keeper-tests}. {@code threadId} is absent until the form has been
 * sent; reminder jobs require it.
 *
 * @param title
 *            check-in title, e.g. "30 Day check-in"
 * @param employee
 *            the employee being assessed
 * @param manager
 *            the manager who receives the form
 * @param threadId
 *            id of the posted form message, reminders reply in its thread
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeeperTestPayloadType(@JsonProperty("title") @NotBlank String title,
        @JsonProperty("employee") @Valid @NotNull JobPersonType employee,
        @JsonProperty("manager") @Valid @NotNull JobPersonType manager,
        @JsonProperty("threadId") String threadId) {

    /**
     * Titles of probation check-ins. Their form asks for a hiring recommendation.
     */
    private static final Set<String> PROBATION_CHECK_INS = Set.of("30 Day check-in",
            "60 Day check-in", "80 Day check-in");

    public KeeperTestPayloadType withThreadId(String threadId) {
        return new KeeperTestPayloadType(title, employee, manager, threadId);
    }

    @JsonIgnore
    public boolean isProbationCheckIn() {
        return isProbationCheckIn(title);
    }

    public static boolean isProbationCheckIn(String title) {
        return title != null && PROBATION_CHECK_INS.contains(title);
    }
}
