package com.nestfind.backend.support;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.nestfind.backend.modules.auth.application.OtpMailSender;

/**
 * Captures mailed codes so tests can read them back.
 */
public class RecordingOtpMailSender implements OtpMailSender {

    private final Map<String, String> lastCodes = new ConcurrentHashMap<>();
    private volatile boolean failing;

    @Override
    public void sendOtp(String email, String code) {
        if (failing) {
            throw new IllegalStateException("SMTP unavailable");
        }
        lastCodes.put(email, code);
    }

    public String lastCodeFor(String email) {
        String code = lastCodes.get(email);
        if (code == null) {
            throw new IllegalStateException("No code mailed to " + email);
        }
        return code;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public void reset() {
        lastCodes.clear();
        failing = false;
    }
}
