package com.webdynamo.contact_manager.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webdynamo.contact_manager.dto.ErrorResponse;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.service.MetricsService;
import com.webdynamo.contact_manager.service.RateLimitService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Token-bucket rate limiting. Runs after {@link SessionAuthenticationFilter},
 * so authenticated callers are limited per user and anonymous ones per client IP.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimitService rateLimitService;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        String username = authentication != null && authentication.getPrincipal() instanceof User user
                ? user.getUsername()
                : null;
        String clientIp = rateLimitService.resolveClientIp(request);

        RateLimitService.Decision decision = rateLimitService.consume(username, clientIp);
        metricsService.recordRateLimit(decision.tier(), decision.allowed());

        if (decision.allowed()) {
            response.setHeader("X-Rate-Limit-Remaining", String.valueOf(decision.remaining()));
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("Rate limit exceeded for {} {} ({} {})", request.getMethod(), request.getRequestURI(),
                decision.tier(), username != null ? username : clientIp);

        ErrorResponse errorResponse = new ErrorResponse(
                String.format("Rate limit exceeded. You can retry in %d seconds.", decision.retryAfterSeconds())
        );

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        response.setHeader("X-Rate-Limit-Remaining", "0");
        response.getWriter().write(objectMapper.writeValueAsString(errorResponse));
    }
}
