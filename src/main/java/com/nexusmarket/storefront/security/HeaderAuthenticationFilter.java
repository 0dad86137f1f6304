package com.nexusmarket.storefront.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Authentication filter that trusts identity headers set by the API gateway.
 *
 * Headers:
 * - X-User-Id: User identifier (required for authenticated requests)
 * - X-User-Role: CUSTOMER, SELLER or ADMIN (optional, defaults to CUSTOMER)
 *
 * The gateway validates the caller's token and strips these headers from external requests;
 * this service does not issue or verify credentials itself.
 *
 * @author Storefront Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    static final String DEFAULT_ROLE = "CUSTOMER";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);

        if (userId != null && !userId.isBlank()) {
            String role = request.getHeader(USER_ROLE_HEADER);
            if (role == null || role.isBlank()) {
                role = DEFAULT_ROLE;
            }
            role = role.trim().toUpperCase(Locale.ROOT);
            if (!role.startsWith("ROLE_")) {
                role = "ROLE_" + role;
            }

            UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
                    userId.trim(), null, List.of(new SimpleGrantedAuthority(role)));

            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(authentication);
            SecurityContextHolder.setContext(context);

            logger.debug("Authenticated user: {} with role: {}", userId, role);
        }

        filterChain.doFilter(request, response);
    }
}
