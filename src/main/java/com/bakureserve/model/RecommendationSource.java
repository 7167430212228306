package com.bakureserve.model;

public enum RecommendationSource {
    REMOTE,
    LOCAL
}
