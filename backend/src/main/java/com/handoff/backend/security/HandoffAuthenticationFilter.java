package com.handoff.backend.security;

import com.handoff.backend.exception.UnauthorizedException;
import com.handoff.backend.service.MetricsService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Runs {@link AuthGuard} before any business logic. Rejected requests never reach the controllers.
 */
@Slf4j
@RequiredArgsConstructor
public class HandoffAuthenticationFilter extends OncePerRequestFilter {

    public static final String TOKEN_HEADER = "X-Auth-Token";
    public static final String SIGNATURE_HEADER = "X-Signature";
    public static final String TIMESTAMP_HEADER = "X-Timestamp";
    public static final String PRINCIPAL_ATTRIBUTE = HandoffAuthenticationFilter.class.getName() + ".principal";

    private final AuthGuard authGuard;
    private final AuthenticationEntryPoint authenticationEntryPoint;
    private final MetricsService metricsService;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final List<String> protectedPaths = List.of(
            "/ingest/**",
            "/api/**"
    );

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(request);
        try {
            CallerPrincipal principal = authGuard.verify(new AuthGuard.AuthRequest(
                    cached.getHeader(TOKEN_HEADER),
                    cached.getHeader(SIGNATURE_HEADER),
                    cached.getHeader(TIMESTAMP_HEADER),
                    cached.getBody(),
                    cached.getRemoteAddr()));
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    principal,
                    null,
                    List.of(new SimpleGrantedAuthority("ROLE_AGENT"))
            );
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(cached));
            SecurityContextHolder.getContext().setAuthentication(authentication);
            cached.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
            log.debug("Authenticated caller via {}", principal.getMode());
        } catch (UnauthorizedException e) {
            SecurityContextHolder.clearContext();
            metricsService.incrementAuthFailures(e.getReason());
            log.warn("Rejected {} {} from {}: {}", request.getMethod(), request.getRequestURI(),
                    request.getRemoteAddr(), e.getMessage());
            authenticationEntryPoint.commence(cached, response, new BadCredentialsException(e.getMessage(), e));
            return;
        }

        filterChain.doFilter(cached, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        return "OPTIONS".equalsIgnoreCase(request.getMethod())
                || protectedPaths.stream().noneMatch(pattern -> pathMatcher.match(pattern, path));
    }
}
