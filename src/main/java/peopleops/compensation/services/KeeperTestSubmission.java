package peopleops.compensation.services;

import peopleops.compensation.exceptions.InvalidInteractionException;

import java.util.UUID;

/**
 * Identity of a submitted keeper test form, decoded from the submit button value.
 *
 * <p>
 * The value is {@code employeeEmail|employeeId|managerName|managerId|jobId|title}, as written by
 * {@link KeeperTestMessageBuilder#submitValue}. The title is the last part and may itself contain {@code |}.
 */
public record KeeperTestSubmission(String employeeEmail, String employeeId, String managerName, String managerId,
        UUID jobId, String title) {

    private static final int PARTS = 6;

    /**
     * @throws InvalidInteractionException
     *             if the value does not have six parts or the job id is not a UUID
     */
    public static KeeperTestSubmission parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidInteractionException("Submit action carries no value");
        }
        String[] parts = value.split("\\|", PARTS);
        if (parts.length != PARTS) {
            throw new InvalidInteractionException(
                    "Submit value has " + parts.length + " parts, expected " + PARTS);
        }
        UUID jobId;
        try {
            jobId = UUID.fromString(parts[4]);
        } catch (IllegalArgumentException e) {
            throw new InvalidInteractionException("Submit value has an invalid job id: " + parts[4], e);
        }
        return new KeeperTestSubmission(parts[0], parts[1], parts[2], parts[3], jobId, parts[5]);
    }
}
