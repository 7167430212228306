package com.bakureserve.controller;

import com.bakureserve.fixtures.RestaurantFixtures;
import com.bakureserve.repository.RestaurantDirectory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RestaurantController.class)
class RestaurantControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RestaurantDirectory restaurantDirectory;

    @Test
    void listsDirectory() throws Exception {
        when(restaurantDirectory.findAll()).thenReturn(RestaurantFixtures.directory());

        mockMvc.perform(get("/api/restaurants"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(5))
                .andExpect(jsonPath("$[0].priceTier").value(3));
    }

    @Test
    void unknownRestaurantIsNotFound() throws Exception {
        when(restaurantDirectory.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/restaurants/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Not Found"));
    }
}
