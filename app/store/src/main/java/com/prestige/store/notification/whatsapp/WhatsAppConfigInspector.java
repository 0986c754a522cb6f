package com.prestige.store.notification.whatsapp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 管理画面向けに WhatsApp 設定の不足項目と利用可能機能をまとめる。 */
@Component
@RequiredArgsConstructor
public class WhatsAppConfigInspector {

  private final WhatsAppProperties properties;

  public WhatsAppConfigStatus inspect() {
    final List<String> issues = new ArrayList<>();
    if (properties.provider() == WhatsAppProvider.TWILIO) {
      if (properties.twilio().accountSid().isBlank()) {
        issues.add("store.whatsapp.twilio.account-sid not configured");
      }
      if (properties.twilio().authToken().isBlank()) {
        issues.add("store.whatsapp.twilio.auth-token not configured");
      }
    } else if (properties.provider() == WhatsAppProvider.META) {
      if (properties.meta().accessToken().isBlank()) {
        issues.add("store.whatsapp.meta.access-token not configured");
      }
      if (properties.meta().phoneNumberId().isBlank()) {
        issues.add("store.whatsapp.meta.phone-number-id not configured");
      }
    }
    final boolean live = properties.provider() != WhatsAppProvider.MOCK;
    final Map<String, Boolean> features = new LinkedHashMap<>();
    features.put("text_messages", true);
    features.put("media_messages", true);
    features.put("template_messages", live);
    features.put("webhooks", live);
    features.put("bulk_messaging", true);
    return new WhatsAppConfigStatus(
        properties.provider().id(),
        properties.effectiveProvider().id(),
        properties.businessNumber(),
        issues.isEmpty(),
        issues,
        features);
  }
}
