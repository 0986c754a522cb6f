package com.prestige.store.config;

import com.prestige.store.service.AdminAuthService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** 起動時、管理者が存在しなければ設定値から初期管理者を作る。 */
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(AdminBootstrap.class);

  private final AdminAuthProperties properties;
  private final AdminAuthService adminAuthService;

  @Override
  public void run(ApplicationArguments args) {
    final AdminAuthProperties.Bootstrap bootstrap = properties.bootstrap();
    if (!bootstrap.enabled()) {
      return;
    }
    if (bootstrap.password() == null || bootstrap.password().length() < 8) {
      logger.warn("bootstrap admin skipped: password must be at least 8 characters");
      return;
    }
    adminAuthService.ensureBootstrapAdmin(
        bootstrap.username(), bootstrap.email(), bootstrap.password());
  }
}
