/*
 * どこで: Store API の結合テスト
 * 何を: 初期管理者でのログインから管理 API 呼び出しまでを実際のフィルタチェーン越しに検証する
 * なぜ: 公開ルートと保護ルートの振り分けやトークン検証の設定漏れを検出するため
 */
package com.prestige.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestPropertySource(
    properties =
        "spring.datasource.url=jdbc:h2:mem:store_it;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;"
            + "DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1")
class StoreSecurityIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @Test
  void publicCatalogNeedsNoToken() throws Exception {
    mockMvc
        .perform(get("/api/watches"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(4));
  }

  @Test
  void healthReportsMockProvider() throws Exception {
    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.whatsapp_provider").value("mock"));
  }

  @Test
  void adminRoutesRequireToken() throws Exception {
    mockMvc.perform(get("/api/admin/watches")).andExpect(status().isUnauthorized());
    mockMvc.perform(get("/api/settings")).andExpect(status().isUnauthorized());
    mockMvc.perform(get("/api/auth/me")).andExpect(status().isUnauthorized());
  }

  @Test
  void tamperedTokenIsRejected() throws Exception {
    final String token = login();
    final String tampered = token.substring(0, token.lastIndexOf('.') + 1) + "c2lnbmF0dXJl";

    mockMvc
        .perform(
            get("/api/admin/watches").header(HttpHeaders.AUTHORIZATION, "Bearer " + tampered))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void bootstrapAdminCanUseAdminRoutes() throws Exception {
    final String bearer = "Bearer " + login();

    mockMvc
        .perform(get("/api/admin/watches").header(HttpHeaders.AUTHORIZATION, bearer))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.length()").value(4))
        .andExpect(jsonPath("$.stats.total_watches").value(4));
    mockMvc
        .perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, bearer))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.username").value("admin"))
        .andExpect(jsonPath("$.role").value("admin"));
    mockMvc
        .perform(get("/api/settings").header(HttpHeaders.AUTHORIZATION, bearer))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.settings.company_name.value").value("Prestige Timepieces"));
  }

  @Test
  void customerInquiryIsVisibleToAdmin() throws Exception {
    mockMvc
        .perform(
            post("/api/inquiries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"customer_name":"Integration Ana","customer_email":"ana@example.com",
                     "message":"Do you buy vintage Omegas?"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.status").value("pending"));

    mockMvc
        .perform(
            get("/api/admin/inquiries")
                .param("status", "pending")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + login()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0].customer_name").value("Integration Ana"));
  }

  @Test
  void nonAdminRoleCannotCreateUsers() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/create-user")
                .with(
                    jwt()
                        .jwt(
                            token ->
                                token
                                    .subject("1")
                                    .claim("username", "staff-member")
                                    .claim("role", "staff")))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"username":"newbie","email":"newbie@example.com","password":"password-1"}
                    """))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("FORBIDDEN"))
        .andExpect(jsonPath("$.message").value("insufficient permissions"));
  }

  @Test
  void wrongPasswordReturns401Json() throws Exception {
    mockMvc
        .perform(
            post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"admin\",\"password\":\"not-the-password\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
  }

  private String login() throws Exception {
    final String body =
        mockMvc
            .perform(
                post("/api/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"username\":\"admin\",\"password\":\"admin-password\"}"))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
    final JsonNode json = objectMapper.readTree(body);
    assertThat(json.path("token_type").asText()).isEqualTo("Bearer");
    return json.path("token").asText();
  }
}
