/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として公開する
 * なぜ: updated_at の打刻やトークン有効期限をテストで固定時刻に差し替えるため
 */
package com.prestige.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
