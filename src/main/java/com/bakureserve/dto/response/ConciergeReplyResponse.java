package com.bakureserve.dto.response;

import com.bakureserve.model.ConciergeMessage;
import com.bakureserve.model.RecommendationSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConciergeReplyResponse {
    private String sessionId;
    private ConciergeMessage reply; // 버려진 경우 null
    /** 완료 전에 더 새로운 질의가 들어와 무효화됨 */
    private boolean discarded;
    private boolean booking;
    private boolean needsMoreInfo;
    private boolean relaxed;
    private RecommendationSource source;
}
