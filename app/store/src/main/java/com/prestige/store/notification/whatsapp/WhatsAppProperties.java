/*
 * どこで: WhatsApp 連携の設定バインド
 * 何を: 利用プロバイダ・認証情報・タイムアウトを保持する
 * なぜ: 環境変数だけで Twilio / Meta / mock を切り替えられるようにするため
 */
package com.prestige.store.notification.whatsapp;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "store.whatsapp")
public record WhatsAppProperties(
    WhatsAppProvider provider,
    String businessNumber,
    String verifyToken,
    Duration connectTimeout,
    Duration readTimeout,
    Twilio twilio,
    Meta meta,
    Mock mock) {

  public WhatsAppProperties {
    provider = provider == null ? WhatsAppProvider.MOCK : provider;
    businessNumber =
        businessNumber == null || businessNumber.isBlank() ? "+1234567890" : businessNumber;
    verifyToken =
        verifyToken == null || verifyToken.isBlank()
            ? "prestige_timepieces_verify_token"
            : verifyToken;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    twilio = twilio == null ? new Twilio(null, null, null, null) : twilio;
    meta = meta == null ? new Meta(null, null, null, null) : meta;
    mock = mock == null ? new Mock(null) : mock;
  }

  public record Twilio(String baseUrl, String accountSid, String authToken, String fromNumber) {

    public Twilio {
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.twilio.com" : baseUrl;
      accountSid = accountSid == null ? "" : accountSid;
      authToken = authToken == null ? "" : authToken;
      fromNumber =
          fromNumber == null || fromNumber.isBlank() ? "whatsapp:+14155238886" : fromNumber;
    }

    public boolean isConfigured() {
      return !accountSid.isBlank() && !authToken.isBlank();
    }
  }

  public record Meta(String baseUrl, String apiVersion, String accessToken, String phoneNumberId) {

    public Meta {
      baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://graph.facebook.com" : baseUrl;
      apiVersion = apiVersion == null || apiVersion.isBlank() ? "v18.0" : apiVersion;
      accessToken = accessToken == null ? "" : accessToken;
      phoneNumberId = phoneNumberId == null ? "" : phoneNumberId;
    }

    public boolean isConfigured() {
      return !accessToken.isBlank() && !phoneNumberId.isBlank();
    }
  }

  public record Mock(Duration latency) {

    public Mock {
      latency = latency == null ? Duration.ofMillis(500) : latency;
    }
  }

  /** 実際に送信へ使われるプロバイダ。認証情報が欠けていれば mock へ落とす。 */
  public WhatsAppProvider effectiveProvider() {
    if (provider == WhatsAppProvider.TWILIO && !twilio.isConfigured()) {
      return WhatsAppProvider.MOCK;
    }
    if (provider == WhatsAppProvider.META && !meta.isConfigured()) {
      return WhatsAppProvider.MOCK;
    }
    return provider;
  }
}
