package com.nexusmarket.storefront.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Helpers for reading the caller's identity from the security context.
 *
 * @author Storefront Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID, or null if the request is anonymous
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        Object principal = authentication.getPrincipal();
        return principal instanceof String ? (String) principal : null;
    }

    /**
     * Get the current user ID, failing if the request is anonymous.
     *
     * @throws AccessDeniedException if not authenticated
     */
    public static String requireCurrentUserId() {
        String userId = getCurrentUserId();
        if (userId == null) {
            throw new AccessDeniedException("User not authenticated");
        }
        return userId;
    }

    /**
     * Check if the current user has a specific role.
     *
     * @param role Role to check, with or without the ROLE_ prefix
     */
    public static boolean hasRole(String role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }

        String roleWithPrefix = role.startsWith("ROLE_") ? role : "ROLE_" + role;
        return authentication.getAuthorities().stream()
                .anyMatch(authority -> authority.getAuthority().equals(roleWithPrefix));
    }

    public static boolean isAdmin() {
        return hasRole("ADMIN");
    }

    /**
     * Buyer scope for order queries: null for administrators (all orders), the caller otherwise.
     */
    public static String buyerScope() {
        return isAdmin() ? null : requireCurrentUserId();
    }
}
