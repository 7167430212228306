package com.bakureserve.controller;

import com.bakureserve.dto.response.ConciergeReplyResponse;
import com.bakureserve.dto.response.ConciergeSessionResponse;
import com.bakureserve.exception.ConciergeNotFoundException;
import com.bakureserve.model.ConciergeMessage;
import com.bakureserve.model.ConciergeMode;
import com.bakureserve.model.RecommendationSource;
import com.bakureserve.service.ConciergeService;
import com.bakureserve.service.concierge.PromptCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConciergeController.class)
@Import(PromptCatalog.class)
class ConciergeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConciergeService conciergeService;

    @Test
    void listsCuratedPrompts() throws Exception {
        mockMvc.perform(get("/api/concierge/prompts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(6))
                .andExpect(jsonPath("$[0].id").value("romantic_views"));
    }

    @Test
    void opensSession() throws Exception {
        ConciergeMessage intro = ConciergeMessage.assistant("Tell me the mood", null, null);
        when(conciergeService.openSession())
                .thenReturn(new ConciergeSessionResponse("s-1", Instant.now(), ConciergeMode.LOCAL, List.of(intro)));

        mockMvc.perform(post("/api/concierge/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.messages[0].role").value("assistant"));
    }

    @Test
    void sendsMessageAsynchronously() throws Exception {
        ConciergeReplyResponse reply = ConciergeReplyResponse.builder()
                .sessionId("s-1")
                .reply(ConciergeMessage.assistant("Here are spots for rooftop.", List.of(), null))
                .relaxed(false)
                .source(RecommendationSource.LOCAL)
                .build();
        when(conciergeService.submitText("s-1", "rooftop drinks")).thenReturn(CompletableFuture.completedFuture(reply));

        MvcResult result = mockMvc.perform(post("/api/concierge/sessions/s-1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"rooftop drinks\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reply.text").value("Here are spots for rooftop."))
                .andExpect(jsonPath("$.source").value("LOCAL"))
                .andExpect(jsonPath("$.discarded").value(false));
    }

    @Test
    void blankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/concierge/sessions/s-1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation failed"))
                .andExpect(jsonPath("$.errors[0].field").value("text"));

        verifyNoInteractions(conciergeService);
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        when(conciergeService.submitText(anyString(), anyString()))
                .thenThrow(ConciergeNotFoundException.session("missing"));

        mockMvc.perform(post("/api/concierge/sessions/missing/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"rooftop drinks\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.path").value("/api/concierge/sessions/missing/messages"));
    }

    @Test
    void closesSession() throws Exception {
        mockMvc.perform(delete("/api/concierge/sessions/s-1"))
                .andExpect(status().isNoContent());
    }
}
