package com.localllm.agent.transport;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Minimal text/event-stream parser: {@code event:}, {@code data:} and
 * {@code id:} fields, comment lines, multi-line data joined with '\n'.
 * Shared by the HTTP tool transports and the streaming LLM client.
 */
public class ServerSentEventReader implements Closeable {

    private final BufferedReader reader;

    public ServerSentEventReader(InputStream in) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    /** Blocks until the next complete event. Returns null at end of stream. */
    public ServerSentEvent next() throws IOException {
        String event = null;
        String id = null;
        StringBuilder data = null;

        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                if (data != null) {
                    return new ServerSentEvent(event != null ? event : ServerSentEvent.DEFAULT_EVENT, data.toString(), id);
                }
                event = null;
                id = null;
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }
            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            switch (field) {
                case "event" -> event = value;
                case "id" -> id = value;
                case "data" -> {
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                }
                default -> {
                    // retry and unknown fields are ignored
                }
            }
        }
        // stream ended without a trailing blank line
        if (data != null) {
            return new ServerSentEvent(event != null ? event : ServerSentEvent.DEFAULT_EVENT, data.toString(), id);
        }
        return null;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
