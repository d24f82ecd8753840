package dev.labelflow.config;

import dev.labelflow.infrastructure.security.ActorHeaderAuthenticationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Stateless security. CSRF disabled (API behind the platform gateway, no browser sessions).
 * Identity comes from trusted gateway headers; administrative routes need ADMIN or SUPER_ADMIN.
 */
@Configuration
public class SecurityConfig {

    private static final String[] ADMIN_ROLES = {"ADMIN", "SUPER_ADMIN"};

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(new ActorHeaderAuthenticationFilter(), UsernamePasswordAuthenticationFilter.class)
            .exceptionHandling(e -> e.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                .requestMatchers(HttpMethod.POST, "/projects").hasAnyRole(ADMIN_ROLES)
                .requestMatchers(HttpMethod.POST, "/projects/*/images", "/projects/*/complete",
                        "/projects/*/archive").hasAnyRole(ADMIN_ROLES)
                .requestMatchers("/projects/*/members", "/projects/*/members/**").hasAnyRole(ADMIN_ROLES)
                .requestMatchers(HttpMethod.GET, "/projects/*/assignments/mine").authenticated()
                .requestMatchers("/projects/*/assignments", "/projects/*/assignments/**").hasAnyRole(ADMIN_ROLES)
                .requestMatchers(HttpMethod.POST, "/projects/*/submissions/*/review").hasAnyRole(ADMIN_ROLES)
                .requestMatchers(HttpMethod.GET, "/projects/*/submissions/stats").hasAnyRole(ADMIN_ROLES)
                .anyRequest().authenticated()
            );
        return http.build();
    }
}
