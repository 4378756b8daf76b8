package com.williamcallahan.gvtakeout.extract;

import com.williamcallahan.gvtakeout.model.ConversationType;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jsoup.nodes.Element;

/**
 * Reads a {@code div.haudio} node: voicemail and the three call kinds.
 *
 * <p>The kind comes from the first text node containing one of the marker phrases. Contributor
 * participants, the published time and the duration follow the same last-marker-wins rule as
 * the rest of the extractor.</p>
 */
final class CallRecordExtractor {

    private static final Map<String, ConversationType> TYPE_MARKERS = typeMarkers();

    private sealed interface CallPart {}

    private record Contributors(Map<String, String> participants) implements CallPart {}

    private record Published(OffsetDateTime timestamp) implements CallPart {}

    private record Duration(String value) implements CallPart {}

    private record Transcript(String text) implements CallPart {}

    private record Marker(ConversationType type) implements CallPart {}

    private static final MarkupDispatchTable<CallPart> ROUTES = MarkupDispatchTable.<CallPart>builder()
            .on("div", "contributor vcard", (element, emit) ->
                    emit.accept(new Contributors(ParticipantCollector.collect(element))))
            .on("abbr", "published", (element, emit) ->
                    RfcTimestamps.fromTitle(element).ifPresent(timestamp -> emit.accept(new Published(timestamp))))
            .on("abbr", "duration", (element, emit) ->
                    emit.accept(new Duration(trimParentheses(MarkupText.fullText(element)))))
            .on("span", "full-text", (element, emit) ->
                    emit.accept(new Transcript(MarkupText.fullText(element))))
            .onText((text, emit) -> {
                ConversationType type = classify(text.getWholeText());
                if (type != null) {
                    emit.accept(new Marker(type));
                }
            })
            .build();

    private CallRecordExtractor() {}

    static ConversationFragment.CallRecord extract(Element callRecord) {
        ConversationType type = null;
        Map<String, String> participants = Map.of();
        OffsetDateTime timestamp = null;
        String duration = "";
        String transcript = "";

        for (CallPart part : ROUTES.collect(callRecord)) {
            if (part instanceof Marker marker) {
                if (type == null) {
                    type = marker.type();
                }
            } else if (part instanceof Contributors contributors) {
                participants = contributors.participants();
            } else if (part instanceof Published published) {
                timestamp = published.timestamp();
            } else if (part instanceof Duration value) {
                duration = value.value();
            } else if (part instanceof Transcript value) {
                transcript = value.text();
            }
        }
        return new ConversationFragment.CallRecord(type, participants, timestamp, duration, transcript);
    }

    /**
     * Returns the call kind named by a text node, checking markers in declaration order.
     *
     * @return matching kind, or null when the text carries no marker
     */
    static ConversationType classify(String text) {
        for (Map.Entry<String, ConversationType> marker : TYPE_MARKERS.entrySet()) {
            if (text.contains(marker.getKey())) {
                return marker.getValue();
            }
        }
        return null;
    }

    private static String trimParentheses(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isParenthesis(value.charAt(start))) {
            start++;
        }
        while (end > start && isParenthesis(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isParenthesis(char character) {
        return character == '(' || character == ')';
    }

    private static Map<String, ConversationType> typeMarkers() {
        Map<String, ConversationType> markers = new LinkedHashMap<>();
        markers.put("Voicemail", ConversationType.VOICEMAIL);
        markers.put("Placed call", ConversationType.PLACED_CALL);
        markers.put("Received call", ConversationType.RECEIVED_CALL);
        markers.put("Missed call", ConversationType.MISSED_CALL);
        return markers;
    }
}
