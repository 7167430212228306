package com.bakureserve.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConciergeMessageRequest {
    @NotBlank
    @Size(max = 500)
    private String text; // 사용자가 입력한 자유 텍스트
}
