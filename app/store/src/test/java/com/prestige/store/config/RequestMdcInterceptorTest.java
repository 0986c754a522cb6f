package com.prestige.store.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
    MDC.clear();
  }

  @Test
  void populatesAndClearsRequestKeys() {
    final MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/api/admin/watches/1");
    request.addHeader("X-Request-Id", "req-123");
    request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
    final TestingAuthenticationToken authentication = new TestingAuthenticationToken("42", null);
    authentication.setAuthenticated(true);
    SecurityContextHolder.getContext().setAuthentication(authentication);
    MDC.put("trace_id", "keep-me");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isEqualTo("req-123");
    assertThat(MDC.get("http_method")).isEqualTo("PUT");
    assertThat(MDC.get("http_path")).isEqualTo("/api/admin/watches/1");
    assertThat(MDC.get("client_ip")).isEqualTo("203.0.113.7");
    assertThat(MDC.get("admin_id")).isEqualTo("42");

    interceptor.afterCompletion(request, new MockHttpServletResponse(), new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("admin_id")).isNull();
    assertThat(MDC.get("trace_id")).isEqualTo("keep-me");
  }

  @Test
  void generatesRequestIdAndSkipsAnonymousAdmin() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/watches");
    request.setRemoteAddr("198.51.100.4");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).matches("[0-9a-f]{32}");
    assertThat(MDC.get("client_ip")).isEqualTo("198.51.100.4");
    assertThat(MDC.get("admin_id")).isNull();
  }
}
