package com.nestfind.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.nestfind.backend.modules.auth.application.AccessControlGate;
import com.nestfind.backend.modules.auth.application.AuthenticatedUser;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.presentation.AuthCookies;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates bearer (or access_token cookie) requests through {@link AccessControlGate}.
 * Authorities come from the freshly read user row: {@code STATUS_<status>} always, and
 * {@code ROLE_<code>} only while the account is ACTIVE.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    public static final String AUTH_FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".failure";
    public static final String STATUS_AUTHORITY_PREFIX = "STATUS_";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AccessControlGate accessControlGate;

    public JwtAuthenticationFilter(AccessControlGate accessControlGate) {
        this.accessControlGate = accessControlGate;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String token = resolveToken(request);
        if (token != null) {
            AuthResult<AuthenticatedUser> result = accessControlGate.authenticate(token);
            if (result.success()) {
                AuthenticatedUser user = result.value();
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(user, null, authoritiesOf(user));
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_FAILURE_ATTRIBUTE, result.failure().name());
                log.debug("Access token rejected on {}: {}", request.getRequestURI(), result.failure());
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    static List<GrantedAuthority> authoritiesOf(AuthenticatedUser user) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority(STATUS_AUTHORITY_PREFIX + user.status().name()));
        if (user.isActive()) {
            user.roles().forEach(role -> authorities.add(new SimpleGrantedAuthority("ROLE_" + role)));
        }
        return authorities;
    }

    private static String resolveToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (AuthCookies.ACCESS_TOKEN.equals(cookie.getName()) && !cookie.getValue().isBlank()) {
                    return cookie.getValue();
                }
            }
        }
        return null;
    }
}
