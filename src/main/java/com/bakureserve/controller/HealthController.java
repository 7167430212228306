package com.bakureserve.controller;

import com.bakureserve.repository.RestaurantDirectory;
import com.bakureserve.service.concierge.HybridConciergeDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final HybridConciergeDispatcher dispatcher;
    private final RestaurantDirectory restaurantDirectory;

    /**
     * 헬스체크
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("mode", dispatcher.getMode());
        response.put("restaurants", restaurantDirectory.size());
        return ResponseEntity.ok(response);
    }
}
