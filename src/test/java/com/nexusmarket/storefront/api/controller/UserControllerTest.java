package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.exception.GlobalExceptionHandler;
import com.nexusmarket.storefront.config.SecurityConfig;
import com.nexusmarket.storefront.domain.model.User;
import com.nexusmarket.storefront.service.UserService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(UserController.class)
@ContextConfiguration(classes = {UserController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("UserController Tests")
class UserControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UserService userService;

    @Test
    @DisplayName("GET /users/me - Returns the caller's loyalty balance")
    void getCurrentUser_ReturnsLoyaltyPoints() throws Exception {
        when(userService.getUser("buyer-1")).thenReturn(User.builder().userId("buyer-1").loyaltyPoints(109).build());

        mockMvc.perform(get("/api/v1/users/me").header("X-User-Id", "buyer-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value("buyer-1"))
                .andExpect(jsonPath("$.loyalty_points").value(109));
    }

    @Test
    @DisplayName("GET /users/me - Anonymous caller returns 401")
    void getCurrentUser_Anonymous_Returns401() throws Exception {
        mockMvc.perform(get("/api/v1/users/me"))
                .andExpect(status().isUnauthorized());
    }
}
