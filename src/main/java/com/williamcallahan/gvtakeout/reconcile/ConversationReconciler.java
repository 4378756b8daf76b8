package com.williamcallahan.gvtakeout.reconcile;

import com.williamcallahan.gvtakeout.model.Contact;
import com.williamcallahan.gvtakeout.model.ContactIdentity;
import com.williamcallahan.gvtakeout.model.Conversation;
import com.williamcallahan.gvtakeout.model.Message;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groups in-memory conversations by their exact participant contact set.
 *
 * <p>Produces the same groups {@link GroupQueryService#loadGroup} would build after storing the
 * same conversations: every conversation with at least one participant lands in exactly one group,
 * and each group holds the union of its conversations' messages, most recent first.</p>
 */
@Component
public class ConversationReconciler {
    private static final Logger log = LoggerFactory.getLogger(ConversationReconciler.class);

    private static final Comparator<OffsetDateTime> LATEST_FIRST =
            Comparator.nullsLast(Comparator.<OffsetDateTime>reverseOrder());

    public List<Group> reconcile(List<Conversation> conversations) {
        return reconcile(conversations, new ContactRegistry());
    }

    /**
     * Reconciles using an existing registry so contact ids line up with earlier runs.
     *
     * @return groups ordered by their latest conversation, most recent first
     */
    public List<Group> reconcile(List<Conversation> conversations, ContactRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        Map<ParticipantSetKey, GroupBuilder> groups = new LinkedHashMap<>();

        for (Conversation conversation : conversations) {
            if (conversation.participants().isEmpty()) {
                log.debug("Skipping {} conversation from '{}' with no participants",
                        conversation.type().wireName(), conversation.sourceFile());
                continue;
            }
            Map<Long, Contact> participants = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : conversation.participants().entrySet()) {
                Contact contact = registry.register(new ContactIdentity(entry.getKey(), entry.getValue()));
                participants.put(contact.id(), contact);
            }
            ParticipantSetKey key = ParticipantSetKey.of(participants.keySet());
            groups.computeIfAbsent(key, GroupBuilder::new).add(conversation, participants.values(), registry);
        }

        List<Group> reconciled = new ArrayList<>(groups.size());
        for (GroupBuilder builder : groups.values()) {
            reconciled.add(builder.build());
        }
        reconciled.sort(Comparator.comparing(Group::timestamp, LATEST_FIRST));
        return reconciled;
    }

    private static final class GroupBuilder {
        private final ParticipantSetKey key;
        private final Map<Long, Contact> participants = new LinkedHashMap<>();
        private final List<String> sourceFiles = new ArrayList<>();
        private final List<GroupMessage> messages = new ArrayList<>();
        private OffsetDateTime latest;

        private GroupBuilder(ParticipantSetKey key) {
            this.key = key;
        }

        private void add(Conversation conversation, Iterable<Contact> contacts, ContactRegistry registry) {
            for (Contact contact : contacts) {
                participants.putIfAbsent(contact.id(), contact);
            }
            sourceFiles.add(conversation.sourceFile());
            if (conversation.timestamp() != null
                    && (latest == null || conversation.timestamp().isAfter(latest))) {
                latest = conversation.timestamp();
            }
            for (Message message : conversation.messages()) {
                Contact sender = message.sender().isEmpty()
                        ? null
                        : registry.register(new ContactIdentity(message.sender(), message.senderNumber()));
                messages.add(new GroupMessage(message.timestamp(), sender, message.content(), message.images()));
            }
        }

        private Group build() {
            List<Contact> orderedParticipants = new ArrayList<>(participants.values());
            orderedParticipants.sort(Comparator.comparingLong(Contact::id));
            List<GroupMessage> ordered = new ArrayList<>(messages);
            ordered.sort(GroupMessage.NEWEST_FIRST);
            return new Group(key, orderedParticipants, latest, sourceFiles, ordered);
        }
    }
}
