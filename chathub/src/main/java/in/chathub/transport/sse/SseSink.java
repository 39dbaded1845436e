package in.chathub.transport.sse;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Outbound side of one client connection.
 * A write failure means the client is gone.
 */
public interface SseSink {

    void write(SseFrame frame) throws IOException;

    /**
     * Sink over a blocking output stream; flushes after every frame.
     */
    static SseSink of(OutputStream out) {
        return frame -> {
            out.write(frame.toWire().getBytes(StandardCharsets.UTF_8));
            out.flush();
        };
    }
}
