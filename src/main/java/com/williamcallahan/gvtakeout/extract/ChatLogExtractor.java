package com.williamcallahan.gvtakeout.extract;

import com.williamcallahan.gvtakeout.model.Message;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Element;

/**
 * Reads a {@code div.hChatLog.hfeed} node: every {@code .fn} inside it is a participant and every
 * {@code div.message} is one message, in document order.
 */
final class ChatLogExtractor {

    private sealed interface ChatPart {}

    private record ParticipantFound(ParticipantCollector.Identity identity) implements ChatPart {}

    private record MessageFound(Message message) implements ChatPart {}

    private ChatLogExtractor() {}

    static ConversationFragment.ChatLog extract(Element chatLog) {
        MarkupDispatchTable<ChatPart> routes = MarkupDispatchTable.<ChatPart>builder()
                .onClass("fn", (element, emit) -> emit.accept(new ParticipantFound(
                        new ParticipantCollector.Identity(MarkupText.fullText(element),
                                MarkupText.nearestAncestorTelNumber(element, chatLog)))))
                .on("div", "message", (element, emit) ->
                        emit.accept(new MessageFound(MessageExtractor.extract(element))))
                .build();

        List<ParticipantCollector.Identity> identities = new ArrayList<>();
        List<Message> messages = new ArrayList<>();
        for (ChatPart part : routes.collect(chatLog)) {
            if (part instanceof ParticipantFound found) {
                identities.add(found.identity());
            } else if (part instanceof MessageFound found) {
                messages.add(found.message());
            }
        }
        Map<String, String> participants = ParticipantCollector.toMap(identities);
        return new ConversationFragment.ChatLog(participants, messages);
    }
}
