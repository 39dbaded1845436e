package in.chathub.domain.chat;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Chat message as emitted by the chat_message_created trigger.
 * {@code content} and {@code files} may be absent; everything else is required.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
    @JsonProperty(value = "id", required = true) long id,
    @JsonProperty(value = "chat_id", required = true) long chatId,
    @JsonProperty(value = "sender_id", required = true) long senderId,
    @JsonProperty("content") String content,
    @JsonProperty("files") List<String> files,   // null when the row has no file column value
    @JsonProperty(value = "created_at", required = true) Instant createdAt
) {
    public Message {
        Objects.requireNonNull(createdAt, "created_at");
        files = files == null ? null : List.copyOf(files);
    }
}
