package com.prediction.market.exchange.ratelimit;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prediction.market.exchange.web.ErrorResponse;
import com.prediction.market.exchange.web.OrderController;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Servlet filter that enforces rate limits on incoming API requests.
 *
 * Callers are identified by the {@value OrderController#ACCOUNT_HEADER}
 * header, falling back to the client IP. Over the limit the request is
 * answered with 429 Too Many Requests and a Retry-After header.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private final AccountRateLimiter rateLimiter;
    private final List<String> exemptedPaths;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(AccountRateLimiter rateLimiter, List<String> exemptedPaths, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.exemptedPaths = exemptedPaths != null ? exemptedPaths : List.of();
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        if (isExempted(request.getRequestURI())) {
            filterChain.doFilter(request, response);
            return;
        }

        String identifier = getIdentifier(request);
        if (!rateLimiter.tryAcquire(identifier)) {
            long retryAfter = rateLimiter.getRetryAfterSeconds();
            log.warn("rate limit exceeded: identifier={} path={}", identifier, request.getRequestURI());
            reject(response, identifier, retryAfter);
            return;
        }

        response.setHeader("X-RateLimit-Identifier", identifier);
        filterChain.doFilter(request, response);
    }

    private String getIdentifier(HttpServletRequest request) {
        String accountId = request.getHeader(OrderController.ACCOUNT_HEADER);
        if (accountId != null && !accountId.isBlank()) {
            return "account:" + accountId.trim();
        }
        return "ip:" + getClientIp(request);
    }

    private String getClientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            // first hop is the client
            return forwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private boolean isExempted(String path) {
        for (String exempted : exemptedPaths) {
            if (path.startsWith(exempted)) {
                return true;
            }
        }
        return false;
    }

    private void reject(HttpServletResponse response, String identifier, long retryAfter) throws IOException {
        HttpStatus status = HttpStatus.TOO_MANY_REQUESTS;
        response.setStatus(status.value());
        response.setHeader("Retry-After", String.valueOf(retryAfter));
        response.setHeader("X-RateLimit-Identifier", identifier);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), ErrorResponse.builder()
            .status(status.value())
            .error("RATE_LIMITED")
            .message("Rate limit exceeded for " + identifier + ", retry after " + retryAfter + "s")
            .build());
    }
}
