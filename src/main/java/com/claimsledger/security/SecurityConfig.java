package com.claimsledger.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security configuration.
 *
 * ENDPOINT ACCESS RULES:
 *
 *   PUBLIC  (no token required):
 *     GET  /api/health              - liveness
 *     GET  /api/actuator/health     - health probe
 *     GET  /api/swagger-ui/**       - Swagger UI
 *     GET  /api/v3/api-docs/**      - OpenAPI docs
 *
 *   AUTHENTICATED (any valid JWT):
 *     GET  /api/claims/**, /api/policies/**
 *     POST /api/claims/liability-preview
 *
 *   CLAIMS WRITERS (SUPER_ADMIN, ADMIN, UNDERWRITER):
 *     Every other POST under /api/claims
 *
 * SESSION: Stateless. No HTTP session is created.
 * CSRF:    Disabled; API-only, no browser form submissions.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    static final String[] CLAIMS_WRITER_ROLES = {"SUPER_ADMIN", "ADMIN", "UNDERWRITER"};

    private final JwtTokenProvider tokenProvider;

    public SecurityConfig(JwtTokenProvider tokenProvider) {
        this.tokenProvider = tokenProvider;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm ->
                sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .exceptionHandling(eh ->
                eh.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
            .authorizeHttpRequests(auth -> auth
                // Liveness + probes
                .requestMatchers(HttpMethod.GET, "/health").permitAll()
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                // Swagger UI - open for review (restrict in prod if needed)
                .requestMatchers(
                    "/swagger-ui/**",
                    "/swagger-ui.html",
                    "/v3/api-docs/**").permitAll()
                // Preview writes nothing
                .requestMatchers(HttpMethod.POST, "/claims/liability-preview").authenticated()
                // Registration, ledger appends, status changes, imports
                .requestMatchers(HttpMethod.POST, "/claims", "/claims/**").hasAnyRole(CLAIMS_WRITER_ROLES)
                // Everything else requires authentication
                .anyRequest().authenticated()
            )
            .addFilterBefore(
                new JwtAuthenticationFilter(tokenProvider),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }
}
