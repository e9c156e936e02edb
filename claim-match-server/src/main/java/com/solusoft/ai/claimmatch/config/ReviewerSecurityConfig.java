package com.solusoft.ai.claimmatch.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.solusoft.ai.claimmatch.security.ReviewerAuthProperties;
import com.solusoft.ai.claimmatch.security.ReviewerKeyAuthenticationFilter;
import com.solusoft.ai.claimmatch.security.ReviewerKeyAuthenticationFilter.ReviewerIdentity;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class ReviewerSecurityConfig {

    private final ReviewerAuthProperties authProperties;

    public ReviewerSecurityConfig(ReviewerAuthProperties authProperties) {
        this.authProperties = authProperties;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {

        // Key -> reviewer
        Map<String, ReviewerIdentity> reviewersByKey = new HashMap<>();
        authProperties.getReviewers().forEach((name, reviewer) -> {
            if (reviewer.getKey() != null && reviewer.getRole() != null) {
                reviewersByKey.put(reviewer.getKey(), new ReviewerIdentity(name, reviewer.getRole()));
                log.info("[SEC] Registered reviewer: {} -> {}", name, reviewer.getRole());
            }
        });

        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health/**").permitAll()
                .anyRequest().authenticated()
            )
            .addFilterBefore(
                new ReviewerKeyAuthenticationFilter(authProperties.getHeaderName(), reviewersByKey),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }
}
