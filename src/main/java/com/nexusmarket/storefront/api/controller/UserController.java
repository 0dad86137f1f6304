package com.nexusmarket.storefront.api.controller;

import com.nexusmarket.storefront.api.dto.UserResponse;
import com.nexusmarket.storefront.domain.model.User;
import com.nexusmarket.storefront.security.SecurityUtils;
import com.nexusmarket.storefront.service.UserService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the caller's own account.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    /**
     * Get the caller's loyalty balance.
     */
    @GetMapping("/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<UserResponse> getCurrentUser() {
        User user = userService.getUser(SecurityUtils.requireCurrentUserId());
        return ResponseEntity.ok(new UserResponse(user.getUserId(), user.getLoyaltyPoints()));
    }
}
