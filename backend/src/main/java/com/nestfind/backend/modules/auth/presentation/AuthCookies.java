package com.nestfind.backend.modules.auth.presentation;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.nestfind.backend.modules.auth.application.TokenPair;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * HttpOnly cookie transport for the token pair. Max-age follows each token's own expiry, so
 * admin refresh cookies are shorter-lived than regular ones.
 */
@Component
public class AuthCookies {

    public static final String ACCESS_TOKEN = "access_token";
    public static final String REFRESH_TOKEN = "refresh_token";
    private static final String REFRESH_COOKIE_PATH = "/auth";

    private final Clock clock;
    private final boolean secure;

    public AuthCookies(Clock clock, @Value("${app.auth.cookie-secure:true}") boolean secure) {
        this.clock = clock;
        this.secure = secure;
    }

    public void write(HttpServletResponse response, TokenPair tokens) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(
                ACCESS_TOKEN, tokens.accessToken(), "/", Duration.between(now, tokens.accessTokenExpiresAt())));
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(
                REFRESH_TOKEN, tokens.refreshToken(), REFRESH_COOKIE_PATH,
                Duration.between(now, tokens.refreshTokenExpiresAt())));
    }

    public void clear(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(ACCESS_TOKEN, "", "/", Duration.ZERO));
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(REFRESH_TOKEN, "", REFRESH_COOKIE_PATH, Duration.ZERO));
    }

    public String readRefreshToken(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (REFRESH_TOKEN.equals(cookie.getName()) && !cookie.getValue().isBlank()) {
                return cookie.getValue();
            }
        }
        return null;
    }

    private String cookie(String name, String value, String path, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Strict")
                .path(path)
                .maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge)
                .build()
                .toString();
    }
}
