package dev.labelflow.infrastructure.security;

import dev.labelflow.domain.enums.UserRole;
import dev.labelflow.domain.valueobject.Actor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Turns the identity headers set by the upstream auth layer into a Spring
 * Security principal. The headers are trusted as supplied; requests without a
 * usable identity stay anonymous and are rejected by the authorization rules.
 */
public class ActorHeaderAuthenticationFilter extends OncePerRequestFilter {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String ACTOR_ROLE_HEADER = "X-Actor-Role";
    public static final String OFFICE_USER_HEADER = "X-Office-User";
    static final String MDC_ACTOR_ID = "actorId";

    private static final Logger log = LoggerFactory.getLogger(ActorHeaderAuthenticationFilter.class);

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        Actor actor = resolve(request);
        if (actor == null) {
            chain.doFilter(request, response);
            return;
        }
        UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
                actor, null, List.of(new SimpleGrantedAuthority("ROLE_" + actor.role().name())));
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
        MDC.put(MDC_ACTOR_ID, actor.id().toString());
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_ACTOR_ID);
        }
    }

    private Actor resolve(HttpServletRequest request) {
        String id = request.getHeader(ACTOR_ID_HEADER);
        if (id == null || id.isBlank()) return null;
        try {
            String role = request.getHeader(ACTOR_ROLE_HEADER);
            UserRole userRole = role == null || role.isBlank()
                    ? UserRole.USER
                    : UserRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
            return new Actor(UUID.fromString(id.trim()), userRole,
                    Boolean.parseBoolean(request.getHeader(OFFICE_USER_HEADER)));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed identity headers on {} {}: {}",
                    request.getMethod(), request.getRequestURI(), e.getMessage());
            return null;
        }
    }
}
