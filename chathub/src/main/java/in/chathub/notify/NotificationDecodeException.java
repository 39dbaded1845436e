package in.chathub.notify;

/**
 * Thrown when a single notification payload cannot be turned into an event.
 * The notification is dropped; the listener keeps running.
 */
public class NotificationDecodeException extends RuntimeException {

    private final String channel;

    public NotificationDecodeException(String channel, String message) {
        super(String.format("[%s] %s", channel, message));
        this.channel = channel;
    }

    public NotificationDecodeException(String channel, String message, Throwable cause) {
        super(String.format("[%s] %s", channel, message), cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
