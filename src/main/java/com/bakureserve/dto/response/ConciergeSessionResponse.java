package com.bakureserve.dto.response;

import com.bakureserve.model.ConciergeMessage;
import com.bakureserve.model.ConciergeMode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConciergeSessionResponse {
    private String sessionId;
    private Instant createdAt;
    private ConciergeMode mode;
    private List<ConciergeMessage> messages;
}
