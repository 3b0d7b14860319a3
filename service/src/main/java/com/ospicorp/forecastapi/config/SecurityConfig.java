package com.ospicorp.forecastapi.config;

import static org.springframework.security.config.Customizer.withDefaults;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Open by default. With {@code security.auth.enabled=true} the forecasting endpoints require a
 * JWT bearer token; liveness and API docs stay public.
 */
@Configuration
public class SecurityConfig {

  private static final String[] PUBLIC_ENDPOINTS = {
      "/",
      "/v1/ping",
      "/actuator/health/**",
      "/v3/api-docs/**",
      "/swagger-ui/**",
      "/swagger-ui.html"
  };

  @Bean
  @ConditionalOnProperty(name = "security.auth.enabled", havingValue = "true")
  SecurityFilterChain jwtChain(HttpSecurity http) throws Exception {
    stateless(http)
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(PUBLIC_ENDPOINTS).permitAll()
            .requestMatchers("/v1/forecast/**").authenticated()
            .anyRequest().authenticated())
        .oauth2ResourceServer(oauth -> oauth.jwt(withDefaults()));
    return http.build();
  }

  @Bean
  @ConditionalOnProperty(name = "security.auth.enabled", havingValue = "false", matchIfMissing = true)
  SecurityFilterChain openChain(HttpSecurity http) throws Exception {
    stateless(http).authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
    return http.build();
  }

  private static HttpSecurity stateless(HttpSecurity http) throws Exception {
    return http.csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));
  }
}
