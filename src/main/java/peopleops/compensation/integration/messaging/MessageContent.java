package peopleops.compensation.integration.messaging;

import java.util.List;
import java.util.Map;

/**
 * A message to post: fallback text plus optional rich layout blocks.
 *
 * @param text
 *            plain text shown in notifications and clients without block support
 * @param blocks
 *            platform layout blocks, empty for plain text messages
 */
public record MessageContent(String text, List<Map<String, Object>> blocks) {

    public MessageContent {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static MessageContent text(String text) {
        return new MessageContent(text, List.of());
    }
}
