package com.bakureserve.model;

import java.util.List;

/**
 * 완화 단계에서 제거할 수 있는 제약 (선언 순서 = 제거 순서)
 */
public enum RelaxableConstraint {
    NEIGHBORHOOD,
    TAGS,
    PRICE,
    CUISINES;

    public static List<RelaxableConstraint> dropOrder(boolean strictBudget) {
        if (strictBudget) {
            return List.of(NEIGHBORHOOD, TAGS, CUISINES);
        }
        return List.of(NEIGHBORHOOD, TAGS, PRICE, CUISINES);
    }
}
