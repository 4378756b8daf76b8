package com.williamcallahan.gvtakeout.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.gvtakeout.SqliteTestDatabase;
import com.williamcallahan.gvtakeout.TakeoutFixtures;
import com.williamcallahan.gvtakeout.extract.ConversationExtractor;
import com.williamcallahan.gvtakeout.model.Contact;
import com.williamcallahan.gvtakeout.model.Conversation;
import com.williamcallahan.gvtakeout.model.ConversationType;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies group listing and exact-set loading against a SQLite store.
 */
class GroupQueryServiceTest {

    @TempDir
    Path tempDir;

    private SqliteTestDatabase database;
    private GroupQueryService groupQueryService;
    private final ConversationExtractor extractor = new ConversationExtractor();
    private final List<Conversation> saved = new ArrayList<>();

    private long smsId;
    private long smsCopyId;

    @BeforeEach
    void setUp() {
        database = SqliteTestDatabase.create(tempDir);
        groupQueryService = new GroupQueryService(database.jdbcTemplate());

        smsId = save(TakeoutFixtures.SMS, "sms.html");
        save(TakeoutFixtures.GROUP_MMS, "mms.html");
        save(TakeoutFixtures.VOICEMAIL, "voicemail.html");
        smsCopyId = save(TakeoutFixtures.SMS, "sms-copy.html");
    }

    private long save(String fixture, String fileName) {
        Conversation conversation = extractor.extract(TakeoutFixtures.document(fixture))
                .conversation().orElseThrow().withSourceFile(fileName);
        saved.add(conversation);
        return database.store().save(conversation, null);
    }

    private long contactId(String name) {
        Long id = database.jdbcTemplate().queryForObject("SELECT id FROM contact WHERE name = ?", Long.class, name);
        return id == null ? -1 : id;
    }

    private ParticipantSetKey key(String... names) {
        List<Long> ids = new ArrayList<>();
        for (String name : names) {
            ids.add(contactId(name));
        }
        return ParticipantSetKey.of(ids);
    }

    @Test
    void listGroups_oneSummaryPerParticipantSetNewestFirst() {
        List<GroupSummary> groups = groupQueryService.listGroups();

        assertEquals(3, groups.size());
        assertEquals(key("Me", "Mike Truk", "Tony Smehrik"), groups.get(0).key());
        assertEquals(key("Me", "Tony Smehrik"), groups.get(1).key());
        assertEquals(key("Sleve Mcdichael"), groups.get(2).key());

        GroupSummary pair = groups.get(1);
        assertEquals(ConversationType.CHAT, pair.type());
        assertEquals(smsCopyId, pair.lastConversationId());
        assertEquals(List.of(smsCopyId, smsId), pair.conversationIds());
        assertEquals(5, pair.recentMessages().size());
        assertEquals("doing just fine. I moved to Florida", pair.recentMessages().get(0).content());
        assertEquals(List.of("Tony Smehrik - Text - 2022-07-01T01_06_39Z-2-1"), pair.recentMessages().get(1).images());

        GroupSummary voicemail = groups.get(2);
        assertEquals(ConversationType.VOICEMAIL, voicemail.type());
        assertTrue(voicemail.recentMessages().isEmpty());
    }

    @Test
    void loadGroup_mergesEveryConversationWithTheExactSet() {
        Group group = groupQueryService.loadGroup(key("Me", "Tony Smehrik")).orElseThrow();

        assertEquals(List.of("Me", "Tony Smehrik"), group.participants().stream().map(Contact::name).toList());
        assertEquals(List.of("sms.html", "sms-copy.html"), group.sourceFiles());
        assertEquals(10, group.messages().size());
        assertEquals("Thank you 🙏", group.messages().get(0).content());
        assertEquals("doing just fine. I moved to Florida", group.messages().get(9).content());
        assertEquals("+333", group.messages().get(0).sender().phoneNumber());
        assertTrue(group.timestamp().isEqual(
                OffsetDateTime.of(2022, 6, 30, 18, 6, 39, 894_000_000, ZoneOffset.ofHours(-7))));
    }

    @Test
    void loadGroup_keepsMultipleImagesOnOneMessage() {
        Group group = groupQueryService.loadGroup(key("Me", "Mike Truk", "Tony Smehrik")).orElseThrow();

        assertEquals(6, group.messages().size());
        GroupMessage firstSent = group.messages().get(5);
        assertEquals("Mike Truk", firstSent.sender().name());
        assertEquals(List.of(
                "Group Conversation - 2024-05-23T04_48_32Z-1-1",
                "Group Conversation - 2024-05-23T04_48_32Z-1-2"), firstSent.images());
    }

    @Test
    void loadGroup_subsetsAndSupersetsDoNotMatch() {
        assertTrue(groupQueryService.loadGroup(key("Me")).isEmpty());
        assertTrue(groupQueryService.loadGroup(key("Me", "Mike Truk")).isEmpty());
        assertTrue(groupQueryService.loadGroup(
                ParticipantSetKey.of(List.of(contactId("Me"), contactId("Tony Smehrik"), 999L))).isEmpty());
    }

    @Test
    void loadGroup_callGroupHasNoMessages() {
        Group group = groupQueryService.loadGroup(key("Sleve Mcdichael")).orElseThrow();

        assertEquals(List.of("voicemail.html"), group.sourceFiles());
        assertTrue(group.messages().isEmpty());
    }

    @Test
    void loadGroup_undatedConversationHasNullTimestamp() {
        long id = database.store().save(Conversation.call(
                ConversationType.MISSED_CALL, Map.of("Nobody Dated", ""), null, "", ""), null);

        Group group = groupQueryService.loadGroup(key("Nobody Dated")).orElseThrow();

        assertTrue(id > smsCopyId);
        assertNull(group.timestamp());
    }

    @Test
    void storedGroupsMatchInMemoryReconciliation() {
        ContactRegistry registry = new ContactRegistry();
        List<Group> inMemory = new ConversationReconciler().reconcile(saved, registry);

        assertEquals(groupQueryService.listGroups().size(), inMemory.size());
        for (Group expected : inMemory) {
            List<Long> storedIds = new ArrayList<>();
            for (Contact contact : expected.participants()) {
                storedIds.add(contactId(contact.name()));
            }
            Group stored = groupQueryService.loadGroup(ParticipantSetKey.of(storedIds)).orElseThrow();

            assertEquals(expected.sourceFiles(), stored.sourceFiles());
            assertEquals(expected.messages().stream().map(GroupMessage::content).toList(),
                    stored.messages().stream().map(GroupMessage::content).toList());
            assertTrue(expected.timestamp().isEqual(stored.timestamp()));
        }
    }
}
