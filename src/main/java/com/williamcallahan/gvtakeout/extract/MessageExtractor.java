package com.williamcallahan.gvtakeout.extract;

import com.williamcallahan.gvtakeout.model.Message;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one {@code div.message} node into a {@link Message}.
 *
 * <p>Routes: {@code abbr.dt} gives the time, {@code cite} the sender, {@code q} the text and each
 * {@code img} one attachment reference. Later timestamp, sender and text markers override earlier
 * ones; attachments accumulate in document order.</p>
 */
final class MessageExtractor {
    private static final Logger log = LoggerFactory.getLogger(MessageExtractor.class);

    private sealed interface MessagePart {}

    private record SentAt(OffsetDateTime timestamp) implements MessagePart {}

    private record Sender(String name, String number) implements MessagePart {}

    private record Body(String text) implements MessagePart {}

    private record Attachment(String reference) implements MessagePart {}

    private static final MarkupDispatchTable<MessagePart> ROUTES = MarkupDispatchTable.<MessagePart>builder()
            .on("abbr", "dt", (element, emit) ->
                    RfcTimestamps.fromTitle(element).ifPresent(timestamp -> emit.accept(new SentAt(timestamp))))
            .onTag("cite", (element, emit) -> emit.accept(senderOf(element)))
            .onTag("q", (element, emit) -> emit.accept(new Body(MarkupText.fullText(element))))
            .onTag("img", (element, emit) -> {
                if (element.hasAttr("src")) {
                    emit.accept(new Attachment(element.attr("src")));
                }
            })
            .build();

    private MessageExtractor() {}

    static Message extract(Element messageElement) {
        OffsetDateTime timestamp = null;
        String sender = "";
        String senderNumber = "";
        String content = "";
        List<String> images = new ArrayList<>();

        for (MessagePart part : ROUTES.collect(messageElement)) {
            if (part instanceof SentAt sentAt) {
                timestamp = sentAt.timestamp();
            } else if (part instanceof Sender identity) {
                sender = identity.name();
                senderNumber = identity.number();
            } else if (part instanceof Body body) {
                content = body.text();
            } else if (part instanceof Attachment attachment) {
                images.add(attachment.reference());
            }
        }

        if (sender.isEmpty()) {
            log.warn("Message at {} has no sender marker", timestamp);
        }
        return new Message(timestamp, sender, senderNumber, content, images);
    }

    private static Sender senderOf(Element cite) {
        Elements names = cite.select("abbr.fn, span.fn");
        Elements links = cite.select("a[href^=" + MarkupText.TEL_SCHEME + "]");
        String name = names.isEmpty() ? "" : MarkupText.fullText(names.last());
        String number = links.isEmpty() ? "" : MarkupText.telNumber(links.last());
        return new Sender(name, number);
    }
}
