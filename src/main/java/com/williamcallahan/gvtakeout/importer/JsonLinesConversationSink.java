package com.williamcallahan.gvtakeout.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.gvtakeout.model.Conversation;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes each conversation as one compact JSON document per line.
 *
 * <p>{@link #close()} flushes but does not close the underlying writer; its owner does that.</p>
 */
public class JsonLinesConversationSink implements ConversationSink {

    private final ObjectMapper objectMapper;
    private final Writer writer;

    public JsonLinesConversationSink(ObjectMapper objectMapper, Writer writer) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @Override
    public void write(Conversation conversation, Path sourceDir) throws IOException {
        writer.write(objectMapper.writeValueAsString(conversation));
        writer.write('\n');
    }

    @Override
    public void close() throws IOException {
        writer.flush();
    }
}
