package com.bakureserve.controller;

import com.bakureserve.exception.ConciergeNotFoundException;
import com.bakureserve.model.Restaurant;
import com.bakureserve.repository.RestaurantDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/restaurants")
@CrossOrigin(origins = {"https://bakureserve.az", "http://localhost:8081", "http://localhost:19006"})
@RequiredArgsConstructor
public class RestaurantController {

    private final RestaurantDirectory restaurantDirectory;

    @GetMapping
    public ResponseEntity<List<Restaurant>> getRestaurants() {
        return ResponseEntity.ok(restaurantDirectory.findAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Restaurant> getRestaurant(@PathVariable String id) {
        return restaurantDirectory.findById(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ConciergeNotFoundException("Restaurant not found: " + id));
    }
}
