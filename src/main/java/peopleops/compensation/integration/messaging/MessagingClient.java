package peopleops.compensation.integration.messaging;

/**
 * Messaging platform used by job handlers to reach managers.
 *
 * <p>
 * Implementations throw {@link peopleops.compensation.exceptions.MessagingException} on any failure, including user
 * not found.
 */
public interface MessagingClient {

    /**
     * Resolves a platform user id from an email address.
     *
     * @param email
     *            the user's work email
     * @return platform user id
     */
    String lookupUserByEmail(String email);

    /**
     * Posts a message to a user, optionally as a reply in an existing thread.
     *
     * @param userId
     *            platform user id (direct message channel)
     * @param content
     *            message text and blocks
     * @param threadId
     *            thread to reply in, or null for a new message
     * @return id of the posted message, usable as a thread id
     */
    String postMessage(String userId, MessageContent content, String threadId);

    /**
     * Replies to an interaction through the callback URL the platform supplied with it.
     *
     * @param responseUrl
     *            callback URL from the interaction payload
     * @param content
     *            reply text
     * @param threadId
     *            thread to reply in, or null
     */
    void respond(String responseUrl, MessageContent content, String threadId);
}
