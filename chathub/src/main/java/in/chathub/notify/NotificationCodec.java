package in.chathub.notify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.chathub.domain.chat.Chat;
import in.chathub.domain.chat.Message;
import in.chathub.domain.event.ChatEvent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decodes raw (channel, payload) pairs from the database into events plus their recipients.
 *
 * chat_updated:         {"op":"INSERT|UPDATE|DELETE","old":Chat|null,"new":Chat|null}
 * chat_message_created: {"message":Message,"members":[userId...]}
 */
public final class NotificationCodec {

    private final ObjectReader reader;

    public NotificationCodec() {
        this(new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    /**
     * Missing required properties and explicit nulls for numeric ids are rejected
     * regardless of how {@code mapper} is configured.
     */
    public NotificationCodec(ObjectMapper mapper) {
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * @throws IllegalArgumentException      if the channel is not one of {@link ChangeChannel}
     * @throws NotificationDecodeException   if the payload is malformed
     */
    public ChatNotification decode(String channel, String payload) {
        ChangeChannel changeChannel = ChangeChannel.fromName(channel);
        if (payload == null || payload.isBlank()) {
            throw new NotificationDecodeException(channel, "Empty payload");
        }

        return switch (changeChannel) {
            case CHAT_UPDATED -> decodeChatUpdated(channel, payload);
            case CHAT_MESSAGE_CREATED -> decodeMessageCreated(channel, payload);
        };
    }

    private ChatNotification decodeChatUpdated(String channel, String payload) {
        ChatUpdatedPayload p = read(channel, payload, ChatUpdatedPayload.class);
        if (p.op() == null) {
            throw new NotificationDecodeException(channel, "Missing 'op'");
        }

        ChatEvent event = switch (p.op()) {
            case "INSERT" -> ChatEvent.newChat(require(channel, p.op(), "new", p.newChat()));
            case "UPDATE" -> ChatEvent.addToChat(require(channel, p.op(), "new", p.newChat()));
            case "DELETE" -> ChatEvent.removeFromChat(require(channel, p.op(), "old", p.oldChat()));
            default -> throw new NotificationDecodeException(channel, "Unknown operation: " + p.op());
        };

        return new ChatNotification(event, affectedUsers(p.oldChat(), p.newChat()));
    }

    private ChatNotification decodeMessageCreated(String channel, String payload) {
        MessageCreatedPayload p = read(channel, payload, MessageCreatedPayload.class);
        if (p.message() == null) {
            throw new NotificationDecodeException(channel, "Missing 'message'");
        }
        if (p.members() == null || p.members().contains(null)) {
            throw new NotificationDecodeException(channel, "Missing or invalid 'members'");
        }
        // Membership was captured when the message was written; do not re-derive it.
        return new ChatNotification(ChatEvent.newMessage(p.message()), new LinkedHashSet<>(p.members()));
    }

    /**
     * Users affected by a chat change.
     * <ul>
     *   <li>old and new with equal members: nobody</li>
     *   <li>old and new with different members: union of both</li>
     *   <li>only new (insert): new members</li>
     *   <li>only old (delete): old members</li>
     *   <li>neither: nobody</li>
     * </ul>
     */
    public static Set<Long> affectedUsers(Chat oldChat, Chat newChat) {
        if (oldChat != null && newChat != null) {
            if (oldChat.sameMembersAs(newChat)) {
                return Set.of();
            }
            Set<Long> union = oldChat.memberSet();
            union.addAll(newChat.memberSet());
            return union;
        }
        if (newChat != null) {
            return newChat.memberSet();
        }
        if (oldChat != null) {
            return oldChat.memberSet();
        }
        return Set.of();
    }

    private <T> T read(String channel, String payload, Class<T> type) {
        try {
            T value = reader.forType(type).readValue(payload);
            if (value == null) {
                throw new NotificationDecodeException(channel, "Null payload");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new NotificationDecodeException(channel, "Malformed payload: " + e.getOriginalMessage(), e);
        }
    }

    private static Chat require(String channel, String op, String field, Chat chat) {
        if (chat == null) {
            throw new NotificationDecodeException(channel, op + " requires '" + field + "' chat");
        }
        return chat;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatUpdatedPayload(
        @JsonProperty("op") String op,
        @JsonProperty("old") Chat oldChat,
        @JsonProperty("new") Chat newChat
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageCreatedPayload(
        @JsonProperty("message") Message message,
        @JsonProperty("members") List<Long> members
    ) {}
}
