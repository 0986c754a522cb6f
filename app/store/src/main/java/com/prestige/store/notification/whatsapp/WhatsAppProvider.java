package com.prestige.store.notification.whatsapp;

import java.util.Locale;

public enum WhatsAppProvider {
  TWILIO,
  META,
  MOCK;

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
