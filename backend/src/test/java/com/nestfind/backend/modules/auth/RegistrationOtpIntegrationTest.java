package com.nestfind.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nestfind.backend.modules.auth.application.OtpVerifier;
import com.nestfind.backend.modules.auth.domain.AuthFailure;
import com.nestfind.backend.modules.auth.domain.AuthResult;
import com.nestfind.backend.modules.auth.domain.NestUserStatus;
import com.nestfind.backend.support.AbstractPostgresIntegrationTest;
import com.nestfind.backend.support.AuthTestClient;
import com.nestfind.backend.support.RecordingOtpMailSender;
import com.nestfind.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class RegistrationOtpIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "balcony-view-7";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private RecordingOtpMailSender mailSender;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private OtpVerifier otpVerifier;

    private AuthTestClient client;

    @BeforeEach
    void setUp() {
        client = new AuthTestClient(mockMvc, objectMapper);
        mailSender.reset();
    }

    @Test
    void signUpVerifyThenLogin() throws Exception {
        String email = "tenant@nestfind.test";
        String userId = register(email, "USER");

        assertThat(testUserFactory.reload(UUID.fromString(userId)).getStatus())
                .isEqualTo(NestUserStatus.PENDING_VERIFICATION);
        client.login(email, PASSWORD).andExpect(status().isOk())
                .andExpect(jsonPath("$.user.status").value("PENDING_VERIFICATION"));

        client.verifyOtp(userId, mailSender.lastCodeFor(email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));

        assertThat(testUserFactory.reload(UUID.fromString(userId)).getEmailVerifiedAt()).isNotNull();
        client.login(email, PASSWORD)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.status").value("ACTIVE"));
    }

    @Test
    void agentSignUpGoesToReview() throws Exception {
        String email = "broker@nestfind.test";
        String userId = register(email, "AGENT");

        client.verifyOtp(userId, mailSender.lastCodeFor(email))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IN_REVIEW"));
    }

    @Test
    void duplicateEmailIsRejectedGenerically() throws Exception {
        register("dup@nestfind.test", "USER");

        client.register("Someone Else", "DUP@nestfind.test", PASSWORD, "USER")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("REGISTRATION_FAILED"));
    }

    @Test
    void codeCannotBeUsedTwice() throws Exception {
        String email = "twice@nestfind.test";
        String userId = register(email, "USER");
        String code = mailSender.lastCodeFor(email);

        client.verifyOtp(userId, code).andExpect(status().isOk());
        client.verifyOtp(userId, code)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("OTP_REUSE_BLOCKED"));
    }

    @Test
    void threeWrongCodesLockTheAccount() throws Exception {
        String email = "guesser@nestfind.test";
        String userId = register(email, "USER");
        String code = mailSender.lastCodeFor(email);
        String wrong = code.equals("000000") ? "111111" : "000000";

        client.verifyOtp(userId, wrong)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.attemptsRemaining").value(2));
        client.verifyOtp(userId, wrong)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.attemptsRemaining").value(1));
        client.verifyOtp(userId, wrong)
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.lockedUntil").isNotEmpty());

        client.verifyOtp(userId, code).andExpect(status().isLocked());
        client.login(email, PASSWORD).andExpect(status().isLocked());
    }

    @Test
    void concurrentSubmissionsOfOneCodeSucceedExactlyOnce() throws Exception {
        String email = "race@nestfind.test";
        UUID userId = UUID.fromString(register(email, "USER"));
        String code = mailSender.lastCodeFor(email);

        int contenders = 6;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AuthResult<NestUserStatus>>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                outcomes.add(pool.submit(() -> {
                    start.await();
                    return otpVerifier.verify(userId, code, "127.0.0.1");
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<AuthResult<NestUserStatus>> outcome : outcomes) {
                AuthResult<NestUserStatus> result = outcome.get(30, TimeUnit.SECONDS);
                if (result.success()) {
                    successes++;
                } else {
                    assertThat(result.failure()).isEqualTo(AuthFailure.OTP_REUSE_BLOCKED);
                }
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failedDeliveryStillCreatesTheAccount() throws Exception {
        mailSender.setFailing(true);

        client.register("Offline Mail", "offline@nestfind.test", PASSWORD, "USER")
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.userId").isNotEmpty());
    }

    @Test
    void weakPasswordIsRejected() throws Exception {
        client.register("Weak", "weak@nestfind.test", "password", "USER")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("WEAK_PASSWORD"));
    }

    private String register(String email, String accountType) throws Exception {
        return client.json(client.register("Test Person", email, PASSWORD, accountType)
                        .andExpect(status().isAccepted()))
                .path("userId").asText();
    }
}
