package com.williamcallahan.gvtakeout.web;

import com.williamcallahan.gvtakeout.reconcile.Group;
import com.williamcallahan.gvtakeout.reconcile.GroupQueryService;
import com.williamcallahan.gvtakeout.reconcile.GroupSummary;
import com.williamcallahan.gvtakeout.reconcile.ParticipantSetKey;
import java.util.List;
import java.util.NoSuchElementException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to reconciled conversation groups.
 */
@RestController
@RequestMapping("/api/groups")
public class GroupController extends BaseController {

    private final GroupQueryService groupQueryService;

    public GroupController(GroupQueryService groupQueryService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.groupQueryService = groupQueryService;
    }

    @GetMapping
    public List<GroupSummary> listGroups() {
        return groupQueryService.listGroups();
    }

    /**
     * Returns the merged group for a comma-separated contact id key such as {@code 1,4,9}.
     */
    @GetMapping("/{key}")
    public Group group(@PathVariable("key") String key) {
        ParticipantSetKey participantSet = ParticipantSetKey.parse(key);
        return groupQueryService.loadGroup(participantSet)
                .orElseThrow(() -> new NoSuchElementException("No conversations with participant set " + participantSet));
    }

    @Override
    protected String queryDescription() {
        return "query groups";
    }
}
