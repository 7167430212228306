package com.bakureserve.controller;

import com.bakureserve.dto.request.ConciergeMessageRequest;
import com.bakureserve.dto.response.ConciergeReplyResponse;
import com.bakureserve.dto.response.ConciergeSessionResponse;
import com.bakureserve.model.ConciergePrompt;
import com.bakureserve.service.ConciergeService;
import com.bakureserve.service.concierge.PromptCatalog;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/concierge")
@CrossOrigin(origins = {"https://bakureserve.az", "http://localhost:8081", "http://localhost:19006"})
@RequiredArgsConstructor
@Slf4j
public class ConciergeController {

    private final ConciergeService conciergeService;
    private final PromptCatalog promptCatalog;

    /**
     * 큐레이션 프롬프트 칩 조회
     */
    @GetMapping("/prompts")
    public ResponseEntity<List<ConciergePrompt>> getPrompts() {
        return ResponseEntity.ok(promptCatalog.getCuratedPrompts());
    }

    /**
     * 세션 생성 (인트로 메시지 포함)
     */
    @PostMapping("/sessions")
    public ResponseEntity<ConciergeSessionResponse> openSession() {
        ConciergeSessionResponse session = conciergeService.openSession();
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<ConciergeSessionResponse> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(conciergeService.getSession(sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        conciergeService.closeSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    /**
     * 메시지 전송 (예약 또는 탐색 응답)
     */
    @PostMapping("/sessions/{sessionId}/messages")
    public CompletableFuture<ConciergeReplyResponse> sendMessage(@PathVariable String sessionId,
                                                                @Valid @RequestBody ConciergeMessageRequest request) {
        log.info("[Concierge][{}] message received: length={}", sessionId, request.getText().length());
        return conciergeService.submitText(sessionId, request.getText());
    }

    @PostMapping("/sessions/{sessionId}/prompts/{promptId}")
    public CompletableFuture<ConciergeReplyResponse> selectPrompt(@PathVariable String sessionId,
                                                                 @PathVariable String promptId) {
        log.info("[Concierge][{}] prompt selected: {}", sessionId, promptId);
        return conciergeService.submitPrompt(sessionId, promptId);
    }
}
