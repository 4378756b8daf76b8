package com.williamcallahan.gvtakeout.extract;

import com.williamcallahan.gvtakeout.model.Conversation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the fragments of one document into a single {@link Conversation}.
 *
 * <p>A call record takes precedence over a chat log; among fragments of the same kind the last
 * one in document order wins. Title names only add participants that the body did not name, and
 * only for calls whose contributor block was empty.</p>
 */
final class ConversationAssembler {

    private ConversationAssembler() {}

    static ExtractionOutcome assemble(List<ConversationFragment> fragments) {
        ConversationFragment.TitleParties title = null;
        ConversationFragment.ChatLog chatLog = null;
        ConversationFragment.CallRecord callRecord = null;

        for (ConversationFragment fragment : fragments) {
            if (fragment instanceof ConversationFragment.TitleParties parties) {
                title = parties;
            } else if (fragment instanceof ConversationFragment.ChatLog log) {
                chatLog = log;
            } else if (fragment instanceof ConversationFragment.CallRecord record) {
                callRecord = record;
            }
        }

        if (callRecord != null) {
            return assembleCall(callRecord, title);
        }
        if (chatLog != null) {
            Map<String, String> participants = new LinkedHashMap<>(chatLog.participants());
            addTitleParties(participants, title);
            return ExtractionOutcome.extracted(Conversation.chat(participants, chatLog.messages()));
        }
        return ExtractionOutcome.unrecognized("no chat log or call record markup found");
    }

    private static ExtractionOutcome assembleCall(ConversationFragment.CallRecord record,
                                                  ConversationFragment.TitleParties title) {
        if (record.type() == null) {
            return ExtractionOutcome.unrecognized("call record without a Voicemail/Placed/Received/Missed marker");
        }
        Map<String, String> participants = new LinkedHashMap<>(record.participants());
        if (participants.isEmpty()) {
            addTitleParties(participants, title);
        }
        return ExtractionOutcome.extracted(Conversation.call(record.type(), participants,
                record.timestamp(), record.duration(), record.transcript()));
    }

    private static void addTitleParties(Map<String, String> participants,
                                        ConversationFragment.TitleParties title) {
        if (title == null) {
            return;
        }
        for (String name : List.of(title.sender(), title.recipient())) {
            if (!name.isEmpty()) {
                participants.putIfAbsent(name, "");
            }
        }
    }
}
