package in.chathub.domain.event;

/**
 * The closed set of events pushed to connected users.
 * Each type carries the event name used on the SSE wire.
 */
public enum ChatEventType {
    NEW_CHAT("new_chat"),
    ADD_TO_CHAT("add_to_chat"),
    REMOVE_FROM_CHAT("remove_from_chat"),
    NEW_MESSAGE("new_message");

    private final String wireName;

    ChatEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean carriesChat() {
        return this != NEW_MESSAGE;
    }
}
