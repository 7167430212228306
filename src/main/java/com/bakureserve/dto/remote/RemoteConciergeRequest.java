package com.bakureserve.dto.remote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteConciergeRequest {
    private String prompt; // 사용자 원문
    private Integer limit;
}
