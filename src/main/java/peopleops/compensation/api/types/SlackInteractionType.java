package peopleops.compensation.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slack {@code block_actions} interaction payload, as posted in the {@code payload} form field.
 *
 * <p>
 * Only the parts the keeper test form needs are mapped: the pressed button, the current form state keyed by block id
 * then action id, the message the form lives in, and the {@code response_url} for replies.
 *
 * @see <a href="https://api.slack.com/reference/interaction-payloads/block-actions">Block actions payload</a>
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record SlackInteractionType(@JsonProperty("type") String type,
        @JsonProperty("response_url") String responseUrl, @JsonProperty("actions") List<ActionType> actions,
        @JsonProperty("state") StateType state, @JsonProperty("container") ContainerType container) {

    /**
     * The button or element that triggered the interaction, or null.
     */
    public ActionType firstAction() {
        return actions == null || actions.isEmpty() ? null : actions.get(0);
    }

    /**
     * Form inputs keyed by action id, in form order. Block ids are dropped.
     */
    public Map<String, FieldValueType> fieldsByActionId() {
        Map<String, FieldValueType> fields = new LinkedHashMap<>();
        if (state == null || state.values() == null) {
            return fields;
        }
        for (Map<String, FieldValueType> block : state.values().values()) {
            if (block != null) {
                fields.putAll(block);
            }
        }
        return fields;
    }

    /**
     * Timestamp of the message holding the form, used to reply in its thread.
     */
    public String messageTs() {
        return container == null ? null : container.messageTs();
    }

    @JsonIgnoreProperties(
            ignoreUnknown = true)
    public record ActionType(@JsonProperty("action_id") String actionId, @JsonProperty("block_id") String blockId,
            @JsonProperty("value") String value) {
    }

    @JsonIgnoreProperties(
            ignoreUnknown = true)
    public record StateType(@JsonProperty("values") Map<String, Map<String, FieldValueType>> values) {
    }

    /**
     * One form input. Radio buttons carry {@code selected_option} (null until chosen), text inputs carry {@code value}.
     */
    @JsonIgnoreProperties(
            ignoreUnknown = true)
    public record FieldValueType(@JsonProperty("type") String type,
            @JsonProperty("selected_option") SelectedOptionType selectedOption, @JsonProperty("value") String value) {

        public static final String RADIO_BUTTONS = "radio_buttons";

        @JsonIgnore
        public boolean isUnansweredRadio() {
            return RADIO_BUTTONS.equals(type) && selectedOption == null;
        }

        /**
         * The chosen option's value for radios, the typed text otherwise.
         */
        public String answer() {
            if (selectedOption != null) {
                return selectedOption.value();
            }
            return value;
        }
    }

    @JsonIgnoreProperties(
            ignoreUnknown = true)
    public record SelectedOptionType(@JsonProperty("value") String value) {
    }

    @JsonIgnoreProperties(
            ignoreUnknown = true)
    public record ContainerType(@JsonProperty("message_ts") String messageTs) {
    }
}
