package in.chathub.transport.sse;

/**
 * One text/event-stream frame: either a named event with data, or a comment.
 */
public record SseFrame(String event, String data, String comment) {

    public static SseFrame event(String event, String data) {
        return new SseFrame(event, data, null);
    }

    public static SseFrame comment(String text) {
        return new SseFrame(null, null, text);
    }

    public boolean isComment() {
        return comment != null;
    }

    /**
     * Wire form, terminated by the blank line that ends a frame.
     * Multi-line data is split over several data: lines.
     */
    public String toWire() {
        StringBuilder sb = new StringBuilder();
        if (isComment()) {
            sb.append(": ").append(comment).append('\n');
        } else {
            if (event != null) {
                sb.append("event: ").append(event).append('\n');
            }
            String body = data == null ? "" : data;
            for (String line : body.split("\r\n|\r|\n", -1)) {
                sb.append("data: ").append(line).append('\n');
            }
        }
        return sb.append('\n').toString();
    }
}
