package com.nestfind.backend.modules.auth.application;

import java.util.UUID;

/**
 * Pushes a security event to whatever live connections the user currently has open.
 * Delivery is best effort.
 */
public interface UserEventNotifier {

    String SESSION_REVOKED = "session_revoked";
    String SESSIONS_REVOKED_ALL = "sessions_revoked_all";
    String TOKEN_REUSE_DETECTED = "token_reuse_detected";

    void notify(UUID userId, String event);
}
