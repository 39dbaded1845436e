package in.chathub.domain.event;

import in.chathub.domain.chat.Chat;
import in.chathub.domain.chat.Message;

import java.util.Objects;

/**
 * Immutable event delivered to every affected user.
 * One instance is shared by reference across all recipients of a notification.
 *
 * Exactly one of {@code chat} / {@code message} is set, matching {@link ChatEventType#carriesChat()}.
 */
public record ChatEvent(ChatEventType type, Chat chat, Message message) {

    public ChatEvent {
        Objects.requireNonNull(type, "type");
        if (type.carriesChat()) {
            Objects.requireNonNull(chat, "chat is required for " + type);
            if (message != null) {
                throw new IllegalArgumentException(type + " does not carry a message");
            }
        } else {
            Objects.requireNonNull(message, "message is required for " + type);
            if (chat != null) {
                throw new IllegalArgumentException(type + " does not carry a chat");
            }
        }
    }

    public static ChatEvent newChat(Chat chat) {
        return new ChatEvent(ChatEventType.NEW_CHAT, chat, null);
    }

    public static ChatEvent addToChat(Chat chat) {
        return new ChatEvent(ChatEventType.ADD_TO_CHAT, chat, null);
    }

    public static ChatEvent removeFromChat(Chat chat) {
        return new ChatEvent(ChatEventType.REMOVE_FROM_CHAT, chat, null);
    }

    public static ChatEvent newMessage(Message message) {
        return new ChatEvent(ChatEventType.NEW_MESSAGE, null, message);
    }

    /**
     * The object serialized as the SSE data line.
     */
    public Object payload() {
        return type.carriesChat() ? chat : message;
    }
}
