package com.williamcallahan.gvtakeout.extract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Element;

/**
 * Collects hCard identities below a subtree: every {@code .fn} element names a participant and
 * the nearest enclosing {@code tel:} link supplies the number.
 */
final class ParticipantCollector {

    record Identity(String name, String number) {}

    private ParticipantCollector() {}

    static Map<String, String> collect(Element root) {
        MarkupDispatchTable<Identity> table = MarkupDispatchTable.<Identity>builder()
                .onClass("fn", (element, emit) -> emit.accept(
                        new Identity(MarkupText.fullText(element),
                                MarkupText.nearestAncestorTelNumber(element, root))))
                .build();
        return toMap(table.collect(root));
    }

    static Map<String, String> toMap(List<Identity> identities) {
        Map<String, String> participants = new LinkedHashMap<>();
        for (Identity identity : identities) {
            if (!identity.name().isEmpty()) {
                participants.put(identity.name(), identity.number());
            }
        }
        return participants;
    }
}
