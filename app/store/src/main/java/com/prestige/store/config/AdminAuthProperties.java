/*
 * どこで: 管理者認証の設定
 * 何を: JWT 署名鍵・有効期限・発行者と、起動時に作る初期管理者を保持する
 * なぜ: 鍵や初期パスワードを環境変数から差し替えられるようにするため
 */
package com.prestige.store.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "store.admin")
public record AdminAuthProperties(
    String jwtSecret, Duration tokenTtl, String issuer, Bootstrap bootstrap) {

  private static final int MIN_SECRET_BYTES = 32;

  public AdminAuthProperties {
    if (jwtSecret == null || jwtSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException(
          "store.admin.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    tokenTtl = tokenTtl == null ? Duration.ofHours(24) : tokenTtl;
    if (tokenTtl.isZero() || tokenTtl.isNegative()) {
      throw new IllegalArgumentException("store.admin.token-ttl must be positive");
    }
    issuer = issuer == null || issuer.isBlank() ? "prestige-timepieces" : issuer;
    bootstrap = bootstrap == null ? new Bootstrap(null, null, null, false) : bootstrap;
  }

  /** 管理者が 1 人もいないときに作成する初期アカウント。 */
  public record Bootstrap(String username, String email, String password, boolean enabled) {

    public Bootstrap {
      username = username == null || username.isBlank() ? "admin" : username;
      email = email == null || email.isBlank() ? "admin@prestigetimepieces.com" : email;
    }
  }
}
