package com.solusoft.ai.claimmatch.security;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates a reviewer from the API key header. Requests without a known key stay
 * anonymous and are stopped later by the authorization rules.
 */
@Slf4j
public class ReviewerKeyAuthenticationFilter extends OncePerRequestFilter {

    /**
     * Reviewer resolved from a key.
     */
    public record ReviewerIdentity(String name, String role) {}

    private final String headerName;
    private final Map<String, ReviewerIdentity> reviewersByKey;

    public ReviewerKeyAuthenticationFilter(String headerName, Map<String, ReviewerIdentity> reviewersByKey) {
        this.headerName = headerName;
        this.reviewersByKey = Map.copyOf(reviewersByKey);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String clientKey = request.getHeader(headerName);

        if (StringUtils.hasText(clientKey)) {
            ReviewerIdentity reviewer = reviewersByKey.get(clientKey);
            if (reviewer != null) {
                UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                    reviewer.name(), null,
                    Collections.singletonList(new SimpleGrantedAuthority(reviewer.role()))
                );
                SecurityContextHolder.getContext().setAuthentication(auth);
            } else {
                log.warn("Rejected unknown reviewer key on {}", request.getRequestURI());
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }
}
