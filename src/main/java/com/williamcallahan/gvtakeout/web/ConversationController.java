package com.williamcallahan.gvtakeout.web;

import com.williamcallahan.gvtakeout.storage.ConversationPage;
import com.williamcallahan.gvtakeout.storage.ConversationSearchRepository;
import com.williamcallahan.gvtakeout.storage.StoredConversation;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.NoSuchElementException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController extends BaseController {
    private static final int MAX_PAGE_SIZE = 200;

    private final ConversationSearchRepository searchRepository;

    public ConversationController(ConversationSearchRepository searchRepository,
                                  ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.searchRepository = searchRepository;
    }

    @GetMapping
    public ConversationPage search(
            @RequestParam(name = "q", defaultValue = "") String query,
            @RequestParam(name = "limit", defaultValue = "20")
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = MAX_PAGE_SIZE, message = "limit cannot exceed " + MAX_PAGE_SIZE)
            int limit,
            @RequestParam(name = "offset", defaultValue = "0")
            @Min(value = 0, message = "offset must not be negative")
            int offset) {
        List<StoredConversation> conversations = searchRepository.search(query, limit, offset);
        int total = searchRepository.count(query);
        return new ConversationPage(conversations, total, limit, offset);
    }

    @GetMapping("/{id}")
    public StoredConversation conversation(@PathVariable("id") long id) {
        return searchRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("No conversation with id " + id));
    }

    @Override
    protected String queryDescription() {
        return "query conversations";
    }
}
