package com.prestige.store.notification.whatsapp;

import java.util.List;
import org.springframework.lang.Nullable;

/** WhatsApp 送信の 1 回分。失敗時は SendException を投げ、リトライはしない。 */
public interface WhatsAppSender {

  SendResult send(String to, String body, @Nullable String mediaUrl);

  default SendResult send(String to, String body) {
    return send(to, body, null);
  }

  SendResult sendTemplate(String to, String templateName, List<String> params);

  WhatsAppProvider provider();
}
