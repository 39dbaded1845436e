package in.chathub.notify;

/**
 * Database notification channels the hub listens on.
 * The set is fixed at startup; anything else arriving is a wiring bug.
 */
public enum ChangeChannel {
    CHAT_UPDATED("chat_updated"),
    CHAT_MESSAGE_CREATED("chat_message_created");

    private final String channelName;

    ChangeChannel(String channelName) {
        this.channelName = channelName;
    }

    public String channelName() {
        return channelName;
    }

    /**
     * @throws IllegalArgumentException for a channel the hub never subscribes to
     */
    public static ChangeChannel fromName(String name) {
        for (ChangeChannel c : values()) {
            if (c.channelName.equals(name)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown notification channel: " + name);
    }
}
