package com.williamcallahan.gvtakeout.web;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.gvtakeout.model.Contact;
import com.williamcallahan.gvtakeout.model.ConversationType;
import com.williamcallahan.gvtakeout.storage.ConversationSearchRepository;
import com.williamcallahan.gvtakeout.storage.StoredConversation;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies conversation search paging, lookup and parameter validation.
 */
@WebMvcTest(controllers = ConversationController.class)
@Import(ExceptionResponseBuilder.class)
class ConversationControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ConversationSearchRepository searchRepository;

    private static StoredConversation voicemail() {
        return new StoredConversation(4, ConversationType.VOICEMAIL,
                OffsetDateTime.of(2018, 7, 23, 16, 23, 31, 0, ZoneOffset.UTC), "00:00:18", "call me back",
                "voicemail.html", List.of(new Contact(3, "Sleve Mcdichael", "+11111111111")));
    }

    @Test
    void search_returnsPageWithTotal() throws Exception {
        when(searchRepository.search("call", 10, 5)).thenReturn(List.of(voicemail()));
        when(searchRepository.count("call")).thenReturn(6);

        mvc.perform(get("/api/conversations").param("q", "call").param("limit", "10").param("offset", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total", is(6)))
                .andExpect(jsonPath("$.limit", is(10)))
                .andExpect(jsonPath("$.offset", is(5)))
                .andExpect(jsonPath("$.conversations", hasSize(1)))
                .andExpect(jsonPath("$.conversations[0].type", is("voicemail")))
                .andExpect(jsonPath("$.conversations[0].source_file", is("voicemail.html")))
                .andExpect(jsonPath("$.conversations[0].timestamp", is("2018-07-23T16:23:31Z")));
    }

    @Test
    void search_appliesDefaults() throws Exception {
        when(searchRepository.search("", 20, 0)).thenReturn(List.of());
        when(searchRepository.count("")).thenReturn(0);

        mvc.perform(get("/api/conversations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.limit", is(20)))
                .andExpect(jsonPath("$.conversations", hasSize(0)));

        verify(searchRepository).search("", 20, 0);
    }

    @Test
    void search_rejectsOutOfRangeLimit() throws Exception {
        mvc.perform(get("/api/conversations").param("limit", "500"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/conversations").param("offset", "-1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(searchRepository);
    }

    @Test
    void conversation_returnsStoredConversation() throws Exception {
        when(searchRepository.findById(4)).thenReturn(Optional.of(voicemail()));

        mvc.perform(get("/api/conversations/4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id", is(4)))
                .andExpect(jsonPath("$.transcript", is("call me back")))
                .andExpect(jsonPath("$.participants[0].name", is("Sleve Mcdichael")));
    }

    @Test
    void conversation_missingIdIsNotFound() throws Exception {
        when(searchRepository.findById(anyLong())).thenReturn(Optional.empty());

        mvc.perform(get("/api/conversations/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message", is("No conversation with id 99")));
    }
}
