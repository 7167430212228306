package com.bakureserve.dto.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemoteConciergeResult {
    private String id;
    private String name;
    private String area;
    private String address;
    @JsonProperty("price_label")
    private String priceLabel;
    private List<String> tags;
    private String instagram;
    private String summary;
    private String website;
}
