package com.williamcallahan.gvtakeout.extract;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads RFC 3339 timestamps from the {@code title} attribute of {@code abbr} markers.
 *
 * <p>This is the only timestamp encoding the export uses. A missing or malformed attribute is a
 * field-level failure: it is logged and the field stays unset.</p>
 */
final class RfcTimestamps {
    private static final Logger log = LoggerFactory.getLogger(RfcTimestamps.class);
    private static final String TITLE_ATTRIBUTE = "title";

    private RfcTimestamps() {}

    static Optional<OffsetDateTime> fromTitle(Element element) {
        if (!element.hasAttr(TITLE_ATTRIBUTE)) {
            log.warn("No title attribute on <{} class=\"{}\">, timestamp left unset",
                    element.normalName(), element.className());
            return Optional.empty();
        }
        return parse(element.attr(TITLE_ATTRIBUTE));
    }

    static Optional<OffsetDateTime> parse(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value.trim(), DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } catch (DateTimeParseException e) {
            log.warn("Unparseable RFC 3339 timestamp '{}': {}", value, e.getMessage());
            return Optional.empty();
        }
    }
}
