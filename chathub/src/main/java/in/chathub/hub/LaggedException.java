package in.chathub.hub;

/**
 * Raised by a receiver that fell more than a buffer's worth behind its sender.
 * The receiver has already skipped ahead; the next poll returns the oldest retained event.
 */
public class LaggedException extends RuntimeException {

    private final long missed;

    public LaggedException(long missed) {
        super("Receiver lagged, " + missed + " event(s) dropped");
        this.missed = missed;
    }

    public long getMissed() {
        return missed;
    }
}
