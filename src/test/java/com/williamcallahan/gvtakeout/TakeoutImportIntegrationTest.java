package com.williamcallahan.gvtakeout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.gvtakeout.reconcile.GroupQueryService;
import com.williamcallahan.gvtakeout.reconcile.GroupSummary;
import com.williamcallahan.gvtakeout.storage.ConversationSearchRepository;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Verifies a full SQLite import run at startup followed by group and search queries.
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:sqlite::memory:",
        "spring.datasource.hikari.maximum-pool-size=1",
        "app.import.enabled=true",
        "app.takeout.format=sqlite",
        "app.takeout.input-dir=src/test/resources/takeout"
})
class TakeoutImportIntegrationTest {

    @Autowired
    private GroupQueryService groupQueryService;

    @Autowired
    private ConversationSearchRepository searchRepository;

    @Test
    void importedTakeoutIsGroupedAndSearchable() {
        List<GroupSummary> groups = groupQueryService.listGroups();

        assertEquals(5, groups.size());
        assertEquals(3, groups.get(0).participants().size());
        assertTrue(groups.get(groups.size() - 1).type().isCall());
        assertEquals(5, searchRepository.count(""));
        assertEquals(1, searchRepository.count("hornet-skyscraper"));
    }
}
