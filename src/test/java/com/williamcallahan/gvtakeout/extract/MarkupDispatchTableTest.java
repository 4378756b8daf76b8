package com.williamcallahan.gvtakeout.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

/**
 * Verifies tag and class routing order during a single tree walk.
 */
class MarkupDispatchTableTest {

    private static final Document DOCUMENT = Jsoup.parse("""
            <div class="outer box">
              <span class="fn">Ann</span>
              <div class="box"><span class="fn extra">Bob</span></div>
            </div>
            """);

    @Test
    void collect_emitsInDocumentOrderAndDescendsIntoMatches() {
        MarkupDispatchTable<String> table = MarkupDispatchTable.<String>builder()
                .on("div", "box", (element, emit) -> emit.accept("box:" + element.className()))
                .onClass("fn", (element, emit) -> emit.accept("fn:" + element.text()))
                .build();

        assertEquals(List.of("box:outer box", "fn:Ann", "box:box", "fn:Bob"), table.collect(DOCUMENT.body()));
        assertEquals(2, table.routeCount());
    }

    @Test
    void collect_runsEveryMatchingRouteInRegistrationOrder() {
        MarkupDispatchTable<String> table = MarkupDispatchTable.<String>builder()
                .onTag("span", (element, emit) -> emit.accept("span"))
                .on("SPAN", "fn extra", (element, emit) -> emit.accept("extra"))
                .build();

        assertEquals(List.of("span", "span", "extra"), table.collect(DOCUMENT.body()));
    }

    @Test
    void collect_passesTextNodesToTextHandler() {
        MarkupDispatchTable<String> table = MarkupDispatchTable.<String>builder()
                .onText((text, emit) -> {
                    if (!text.isBlank()) {
                        emit.accept(text.text().trim());
                    }
                })
                .build();

        assertEquals(List.of("Ann", "Bob"), table.collect(DOCUMENT.body()));
    }

    @Test
    void collect_withoutRoutesEmitsNothing() {
        assertTrue(MarkupDispatchTable.<String>builder().build().collect(DOCUMENT).isEmpty());
    }
}
