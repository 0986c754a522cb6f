package com.prestige.store.notification;

import java.util.List;
import java.util.Locale;

/** 顧客向けの定型メッセージ。{0}, {1} ... を引数で置き換える。 */
public enum MessageTemplate {
  INQUIRY_CONFIRMATION(
      "Thank you for your inquiry about our luxury timepiece! We've received your message and"
          + " will respond within 24 hours. 🏆"),
  QUOTE_PROVIDED(
      "We've reviewed your watch and prepared a quote. Please check your email or call us to"
          + " discuss the details. 💰"),
  APPOINTMENT_REMINDER(
      "Reminder: You have an appointment with Prestige Timepieces tomorrow. We look forward to"
          + " seeing you! ⌚"),
  WATCH_SOLD(
      "Great news! Your watch has found a new home. We'll process your payment within 24 hours."
          + " 🎉"),
  NEW_ARRIVAL(
      "🆕 New arrival! We just added a stunning timepiece to our collection that matches your"
          + " interests. Check it out!");

  static final String FALLBACK_MESSAGE = "Thank you for your interest in Prestige Timepieces!";

  private final String message;

  MessageTemplate(String message) {
    this.message = message;
  }

  public String templateName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public String render(List<String> params) {
    String rendered = message;
    if (params != null) {
      for (int i = 0; i < params.size(); i++) {
        rendered = rendered.replace("{" + i + "}", params.get(i));
      }
    }
    return rendered;
  }

  /** 名前 (inquiry_confirmation / INQUIRY_CONFIRMATION) で引く。未知の名前は既定文面。 */
  public static String renderByName(String name, List<String> params) {
    if (name == null) {
      return FALLBACK_MESSAGE;
    }
    for (MessageTemplate template : values()) {
      if (template.name().equalsIgnoreCase(name)) {
        return template.render(params);
      }
    }
    return FALLBACK_MESSAGE;
  }
}
