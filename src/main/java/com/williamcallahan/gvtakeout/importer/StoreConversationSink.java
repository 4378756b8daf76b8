package com.williamcallahan.gvtakeout.importer;

import com.williamcallahan.gvtakeout.model.Conversation;
import com.williamcallahan.gvtakeout.storage.ConversationStore;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Persists each conversation through {@link ConversationStore}.
 */
public class StoreConversationSink implements ConversationSink {

    private final ConversationStore store;

    public StoreConversationSink(ConversationStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public void write(Conversation conversation, Path sourceDir) {
        store.save(conversation, sourceDir);
    }
}
