package com.bakureserve.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 앱의 둘러보기 카테고리
 * 프롬프트가 id로 참조하여 카테고리 가산점을 받음
 */
public enum BrowseCategory {
    DATE_NIGHT("date_night",
            r -> r.hasAnyTag(List.of("romantic", "date_night", "couples", "candlelight"))
                    || Integer.valueOf(4).equals(r.getPriceTier())),
    ROOFTOP_VIEWS("rooftop_views",
            r -> r.hasAnyTag(List.of("rooftop", "skyline", "sea_view", "sunset", "terrace"))),
    AZERBAIJANI_LOCAL("azerbaijani_local",
            r -> r.hasCuisineLike("azerbaijani") || r.hasAnyTag(List.of("local_cuisine"))),
    CAFES_BREAKFAST("cafes_breakfast",
            r -> r.hasAnyTag(List.of("breakfast", "brunch", "cafe", "bakery"))),
    BARS_LOUNGES("bars_lounges",
            r -> r.hasAnyTag(List.of("bar", "cocktails", "dj", "late_night", "mixology"))),
    FAMILY_FRIENDLY("family_friendly",
            r -> r.hasAnyTag(List.of("family", "kids_welcome", "group_dining", "brunch"))),
    BUDGET_FRIENDLY("budget_friendly", BrowseCategory::isBudgetFriendly),
    LIVE_MUSIC("live_music",
            r -> r.hasAnyTag(List.of("live_music", "dj", "band", "performance"))),
    CHEF_TABLE("chef_table",
            r -> r.hasAnyTag(List.of("chef_table", "tasting_menu", "open_kitchen", "chef_counter")));

    private final String id;
    private final Predicate<Restaurant> predicate;

    BrowseCategory(String id, Predicate<Restaurant> predicate) {
        this.id = id;
        this.predicate = predicate;
    }

    public String getId() {
        return id;
    }

    public boolean matches(Restaurant restaurant) {
        return predicate.test(restaurant);
    }

    public static Optional<BrowseCategory> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(category -> category.getId().equals(id)).findFirst();
    }

    private static boolean isBudgetFriendly(Restaurant restaurant) {
        Integer tier = restaurant.getPriceTier();
        if (tier != null) {
            return tier <= 2;
        }
        return restaurant.hasAnyTag(List.of("casual", "budget_friendly", "lunch_special"));
    }
}
