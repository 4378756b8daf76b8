package com.williamcallahan.gvtakeout.extract;

import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one parsed takeout document into a conversation record.
 *
 * <p>The document is walked once; each recognized branch is read by its own sub-extractor and
 * emitted as an immutable fragment. The fragments are then folded by {@link ConversationAssembler}.
 * Instances hold no per-document state and may be shared across threads.</p>
 */
@Service
public class ConversationExtractor {
    private static final Logger log = LoggerFactory.getLogger(ConversationExtractor.class);

    private static final String TITLE_SEPARATOR = " to ";

    private final MarkupDispatchTable<ConversationFragment> documentRoutes = MarkupDispatchTable
            .<ConversationFragment>builder()
            .onTag("title", (element, emit) -> titleParties(element).ifPresent(emit))
            .on("div", "hChatLog hfeed", (element, emit) -> emit.accept(ChatLogExtractor.extract(element)))
            .on("div", "haudio", (element, emit) -> emit.accept(CallRecordExtractor.extract(element)))
            .build();

    /**
     * Extracts the conversation described by a takeout document.
     *
     * @param document parsed document
     * @return extracted conversation, or an unrecognized outcome when the document holds neither
     *     a chat log nor a call record
     */
    public ExtractionOutcome extract(Document document) {
        List<ConversationFragment> fragments = documentRoutes.collect(document);
        ExtractionOutcome outcome = ConversationAssembler.assemble(fragments);
        if (outcome instanceof ExtractionOutcome.Unrecognized unrecognized) {
            log.debug("Document {} not recognized: {}", document.location(), unrecognized.reason());
        }
        return outcome;
    }

    private static Optional<ConversationFragment> titleParties(Element title) {
        String text = MarkupText.fullText(title).replace("\n", " ");
        String[] parts = text.split(TITLE_SEPARATOR, -1);
        if (parts.length != 2) {
            return Optional.empty();
        }
        return Optional.of(new ConversationFragment.TitleParties(parts[0].trim(), parts[1].trim()));
    }
}
