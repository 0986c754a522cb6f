package com.prestige.store.notification.whatsapp;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class WhatsAppPropertiesTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
          .withUserConfiguration(PropertiesConfig.class);

  @Test
  void defaultsToMockProvider() {
    contextRunner.run(
        context -> {
          final WhatsAppProperties properties = context.getBean(WhatsAppProperties.class);
          assertThat(properties.provider()).isEqualTo(WhatsAppProvider.MOCK);
          assertThat(properties.effectiveProvider()).isEqualTo(WhatsAppProvider.MOCK);
          assertThat(properties.businessNumber()).isEqualTo("+1234567890");
          assertThat(properties.verifyToken()).isEqualTo("prestige_timepieces_verify_token");
          assertThat(properties.twilio().baseUrl()).isEqualTo("https://api.twilio.com");
          assertThat(properties.meta().apiVersion()).isEqualTo("v18.0");
          assertThat(properties.mock().latency()).isEqualTo(Duration.ofMillis(500));
        });
  }

  @Test
  void twilioWithoutCredentialsFallsBackToMock() {
    contextRunner
        .withPropertyValues("store.whatsapp.provider=twilio", "store.whatsapp.twilio.account-sid=AC1")
        .run(
            context ->
                assertThat(context.getBean(WhatsAppProperties.class).effectiveProvider())
                    .isEqualTo(WhatsAppProvider.MOCK));
  }

  @Test
  void configuredProvidersAreUsed() {
    contextRunner
        .withPropertyValues(
            "store.whatsapp.provider=meta",
            "store.whatsapp.meta.access-token=token",
            "store.whatsapp.meta.phone-number-id=PN1",
            "store.whatsapp.read-timeout=3s")
        .run(
            context -> {
              final WhatsAppProperties properties = context.getBean(WhatsAppProperties.class);
              assertThat(properties.effectiveProvider()).isEqualTo(WhatsAppProvider.META);
              assertThat(properties.readTimeout()).isEqualTo(Duration.ofSeconds(3));
            });
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(WhatsAppProperties.class)
  static class PropertiesConfig {}
}
