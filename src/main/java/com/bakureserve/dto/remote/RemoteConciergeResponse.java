package com.bakureserve.dto.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 원격 랭킹 서비스 응답
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemoteConciergeResponse {
    private List<RemoteConciergeResult> results;
    private String message;
    private String mode; // 랭커가 보고한 모드 ("local" | "ai")
}
