package com.yupacgo.backend.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yupacgo.backend.activity.ActivityAction;
import com.yupacgo.backend.activity.entity.ActivityLog;
import com.yupacgo.backend.activity.repo.ActivityLogRepository;
import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.auth.entity.User;
import com.yupacgo.backend.testsupport.BaseSpringTest;
import com.yupacgo.backend.testsupport.Eventually;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AuthControllerMvcTest extends BaseSpringTest {

    @Autowired ObjectMapper om;
    @Autowired ActivityLogRepository activityLogs;

    @Test
    void signup_then_login_then_use_token() throws Exception {
        String email = "new-" + UUID.randomUUID() + "@Example.com";

        mvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"firstname":"Grace","lastname":"Hopper","email":"%s","password":"cobol60"}
                                """.formatted(email)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Signup successful"))
                .andExpect(jsonPath("$.data.email").value(email.toLowerCase()))
                .andExpect(jsonPath("$.data.role").value("user"))
                .andExpect(jsonPath("$.data.passwordHash").doesNotExist());

        String body = mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"cobol60"}
                                """.formatted(email)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.data.expiresIn").value(3600))
                .andReturn().getResponse().getContentAsString();

        JsonNode data = om.readTree(body).path("data");
        String token = data.path("token").asText();
        long userId = data.path("user").path("id").asLong();

        mvc.perform(get("/api/profile/settings").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(userId));

        Eventually.await(() -> assertThat(
                activityLogs.findByUserIdOrderByOccurredAtDesc(userId, PageRequest.of(0, 10)))
                .extracting(ActivityLog::getAction)
                .contains(ActivityAction.USER_SIGNUP, ActivityAction.USER_LOGIN));
    }

    @Test
    void duplicate_email_is_rejected() throws Exception {
        User existing = newUser(Role.USER);

        mvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"firstname":"A","lastname":"B","email":"%s","password":"abcdef"}
                                """.formatted(existing.getEmail().toUpperCase())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.message").value("Email already exists"));
    }

    @Test
    void signup_validation_failure_names_the_problem() throws Exception {
        mvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"firstname":"A","lastname":"B","email":"x@example.com","password":"123"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.message").value("Password must be at least 6 characters"));
    }

    @Test
    void wrong_password_and_unknown_email_look_the_same() throws Exception {
        User u = newUser(Role.USER);

        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"wrong-one"}
                                """.formatted(u.getEmail())))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_LOGIN"))
                .andExpect(jsonPath("$.message").value("Invalid credentials"));

        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"nobody-%s@example.com","password":"wrong-one"}
                                """.formatted(UUID.randomUUID())))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_LOGIN"));
    }
}
