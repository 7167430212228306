package com.bakureserve.repository;

import com.bakureserve.model.Restaurant;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 식당 디렉터리의 불변 스냅샷
 * 매칭 중에 일부만 갱신된 목록을 보는 일이 없음
 */
public class RestaurantDirectory {

    private static final Logger logger = LoggerFactory.getLogger(RestaurantDirectory.class);

    private final List<Restaurant> restaurants;
    private final Map<String, Restaurant> byId;

    public RestaurantDirectory(List<Restaurant> restaurants) {
        Map<String, Restaurant> index = new LinkedHashMap<>();
        for (Restaurant restaurant : restaurants) {
            if (restaurant.getId() == null || restaurant.getName() == null) {
                logger.warn("[RestaurantDirectory] skipping record without id/name: {}", restaurant);
                continue;
            }
            // 중복 id는 먼저 나온 레코드 유지
            index.putIfAbsent(restaurant.getId(), restaurant);
        }
        this.byId = Map.copyOf(index);
        this.restaurants = List.copyOf(index.values());
    }

    /**
     * JSON 리소스에서 디렉터리 로드
     */
    public static RestaurantDirectory load(ResourceLoader resourceLoader, ObjectMapper objectMapper, String location) {
        logger.info("[RestaurantDirectory] load START - location: {}", location);
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<Restaurant> records = objectMapper.readValue(in, new TypeReference<List<Restaurant>>() {
            });
            RestaurantDirectory directory = new RestaurantDirectory(records);
            logger.info("[RestaurantDirectory] load SUCCESS - restaurants: {}", directory.size());
            return directory;
        } catch (IOException e) {
            logger.error("[RestaurantDirectory] load ERROR - location: {}", location, e);
            throw new UncheckedIOException("Failed to load restaurant directory from " + location, e);
        }
    }

    public List<Restaurant> findAll() {
        return restaurants;
    }

    public Optional<Restaurant> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return restaurants.size();
    }
}
