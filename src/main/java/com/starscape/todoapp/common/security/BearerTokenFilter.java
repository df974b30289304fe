package com.starscape.todoapp.common.security;

import com.starscape.todoapp.features.auth.app.SessionGuard;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Reads the Authorization header on every request and, when {@link SessionGuard}
 * accepts it, puts the verified {@link UserPrincipal} into the SecurityContext.
 * Requests without a valid credential continue unauthenticated and are stopped by
 * the authorization rules before reaching any controller.
 */
@Component
public class BearerTokenFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenFilter.class);

    private final SessionGuard sessionGuard;

    public BearerTokenFilter(SessionGuard sessionGuard) {
        this.sessionGuard = sessionGuard;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (header != null && SecurityContextHolder.getContext().getAuthentication() == null) {
            sessionGuard.authenticate(header).ifPresent(principal -> {
                var authentication = new UsernamePasswordAuthenticationToken(
                        principal, null, principal.getAuthorities());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Authenticated accountId={} path={}", principal.getAccountId(), request.getRequestURI());
            });
        }

        chain.doFilter(request, response);
    }
}
