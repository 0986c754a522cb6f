package com.prestige.store.notification.whatsapp;

import com.prestige.store.notification.Sleeper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({WhatsAppProperties.class, WhatsAppRetryProperties.class})
public class WhatsAppClientConfig {

  private static final Logger logger = LoggerFactory.getLogger(WhatsAppClientConfig.class);

  @Bean
  WhatsAppSender whatsAppSender(
      RestClient.Builder builder, WhatsAppProperties properties, Sleeper sleeper, Clock clock) {
    final WhatsAppProvider effective = properties.effectiveProvider();
    if (effective != properties.provider()) {
      logger.warn(
          "whatsapp credentials are not configured provider={}; falling back to mock",
          properties.provider().id());
    }
    logger.info("whatsapp sender selected provider={}", effective.id());
    switch (effective) {
      case TWILIO:
        return new TwilioWhatsAppSender(
            restClient(builder, properties.twilio().baseUrl(), properties),
            properties.twilio(),
            clock);
      case META:
        return new MetaWhatsAppSender(
            restClient(builder, properties.meta().baseUrl(), properties), properties.meta(), clock);
      default:
        return new MockWhatsAppSender(properties.mock().latency(), sleeper, clock);
    }
  }

  private RestClient restClient(
      RestClient.Builder builder, String baseUrl, WhatsAppProperties properties) {
    // 送信が固まるとキュー全体が止まるため、接続・読み取りとも上限を設ける
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(baseUrl).requestFactory(requestFactory).build();
  }
}
