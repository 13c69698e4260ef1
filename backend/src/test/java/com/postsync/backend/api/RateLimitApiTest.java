package com.postsync.backend.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static com.postsync.backend.api.PostApiTest.fromAddress;
import static com.postsync.backend.api.PostApiTest.uniqueAddress;
import static com.postsync.backend.api.PostApiTest.uniqueClient;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RateLimitApiTest {

    @Autowired
    MockMvc mvc;

    @Test
    void requestsBeyondTheWindowLimitGet429() throws Exception {
        String address = uniqueAddress();
        String clientId = uniqueClient();
        for (int i = 0; i < 5; i++) {
            mvc.perform(get("/api/stats").header("X-Client-Id", clientId).with(fromAddress(address)))
                    .andExpect(status().isOk());
        }

        mvc.perform(get("/api/stats").header("X-Client-Id", clientId).with(fromAddress(address)))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.error").value("RateLimited"))
                .andExpect(jsonPath("$.retry_after_seconds", greaterThan(0)))
                .andExpect(jsonPath("$.retry_after_seconds", lessThanOrEqualTo(60)));

        mvc.perform(get("/api/stats").header("X-Client-Id", clientId).with(fromAddress(uniqueAddress())))
                .andExpect(status().isOk());
    }

    @Test
    void rotatingTheClientIdHeaderDoesNotResetTheLimit() throws Exception {
        String address = uniqueAddress();
        for (int i = 0; i < 5; i++) {
            mvc.perform(get("/api/stats").header("X-Client-Id", uniqueClient()).with(fromAddress(address)))
                    .andExpect(status().isOk());
        }

        mvc.perform(get("/api/stats").header("X-Client-Id", uniqueClient()).with(fromAddress(address)))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void healthIsNeverRateLimited() throws Exception {
        String address = uniqueAddress();
        for (int i = 0; i < 8; i++) {
            mvc.perform(get("/health").with(fromAddress(address))).andExpect(status().isOk());
        }
    }
}
