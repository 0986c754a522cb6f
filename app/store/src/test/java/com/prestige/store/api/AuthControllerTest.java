package com.prestige.store.api;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.prestige.store.api.response.AdminUserResponse;
import com.prestige.store.api.response.LoginResponse;
import com.prestige.store.service.AdminAuthService;
import com.prestige.store.service.InvalidCredentialsException;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AuthController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class AuthControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private AdminAuthService adminAuthService;

  @Test
  void loginReturnsTokenAndUser() throws Exception {
    final Instant expiresAt = Instant.parse("2026-01-02T00:00:00Z");
    when(adminAuthService.login("admin", "admin-password"))
        .thenReturn(
            new LoginResponse(
                "jwt-value",
                "Bearer",
                expiresAt,
                new AdminUserResponse(
                    1L, "admin", "admin@prestigetimepieces.com", "admin", null, null)));

    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"admin\",\"password\":\"admin-password\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.token").value("jwt-value"))
        .andExpect(jsonPath("$.token_type").value("Bearer"))
        .andExpect(jsonPath("$.user.username").value("admin"))
        .andExpect(jsonPath("$.user.password_hash").doesNotExist());
  }

  @Test
  void wrongCredentialsReturn401() throws Exception {
    when(adminAuthService.login("admin", "nope"))
        .thenThrow(new InvalidCredentialsException("invalid credentials"));

    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"admin\",\"password\":\"nope\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
        .andExpect(jsonPath("$.message").value("invalid credentials"));
  }

  @Test
  void missingPasswordReturns400() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"admin\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("password is required"));
    verifyNoInteractions(adminAuthService);
  }

  @Test
  void logoutWithoutTokenStillSucceeds() throws Exception {
    mockMvc
        .perform(post("/api/auth/logout"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("logout successful"));
  }
}
