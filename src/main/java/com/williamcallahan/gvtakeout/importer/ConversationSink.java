package com.williamcallahan.gvtakeout.importer;

import com.williamcallahan.gvtakeout.model.Conversation;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Destination for conversations produced by an import run.
 */
public interface ConversationSink extends Closeable {

    /**
     * Writes one conversation.
     *
     * @param conversation extracted conversation, stamped with its source file
     * @param sourceDir directory the source file was read from
     * @throws IOException when the destination cannot be written
     */
    void write(Conversation conversation, Path sourceDir) throws IOException;

    @Override
    default void close() throws IOException {}
}
