package com.nestfind.backend.support;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.Cookie;

import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

/**
 * Thin MockMvc wrapper for the auth endpoints used across integration tests.
 */
public final class AuthTestClient {

    private final MockMvc mockMvc;
    private final ObjectMapper objectMapper;

    public AuthTestClient(MockMvc mockMvc, ObjectMapper objectMapper) {
        this.mockMvc = mockMvc;
        this.objectMapper = objectMapper;
    }

    public ResultActions login(String email, String password) throws Exception {
        return login(email, password, null);
    }

    public ResultActions login(String email, String password, String portal) throws Exception {
        String portalField = portal == null ? "" : ", \"portal\": \"%s\"".formatted(portal);
        return mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"email": "%s", "password": "%s"%s}
                        """.formatted(email, password, portalField)));
    }

    public ResultActions refresh(String refreshToken) throws Exception {
        return mockMvc.perform(post("/auth/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"refreshToken": "%s"}
                        """.formatted(refreshToken)));
    }

    public ResultActions refresh(String bodyToken, String cookieToken) throws Exception {
        return mockMvc.perform(post("/auth/refresh")
                .cookie(new Cookie("refresh_token", cookieToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"refreshToken": "%s"}
                        """.formatted(bodyToken)));
    }

    public ResultActions me(String accessToken) throws Exception {
        return mockMvc.perform(get("/auth/me").header("Authorization", "Bearer " + accessToken));
    }

    public ResultActions logout(String accessToken) throws Exception {
        return mockMvc.perform(post("/auth/logout").header("Authorization", "Bearer " + accessToken));
    }

    public ResultActions revokeAllSessions(String accessToken, String userId) throws Exception {
        return mockMvc.perform(post("/auth/admin/revoke-all-sessions")
                .header("Authorization", "Bearer " + accessToken)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"userId": "%s"}
                        """.formatted(userId)));
    }

    public ResultActions register(String fullName, String email, String password, String accountType) throws Exception {
        return mockMvc.perform(post("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"fullName": "%s", "email": "%s", "password": "%s", "accountType": "%s"}
                        """.formatted(fullName, email, password, accountType)));
    }

    public ResultActions verifyOtp(String userId, String code) throws Exception {
        return mockMvc.perform(post("/auth/otp/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"userId": "%s", "otp": "%s"}
                        """.formatted(userId, code)));
    }

    public JsonNode json(ResultActions actions) throws Exception {
        MvcResult result = actions.andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
