/*
 * どこで: WhatsApp Webhook の受信処理
 * 何を: 購読確認と、受信メッセージ・配信ステータス通知の処理を行う
 * なぜ: 価格問い合わせへの自動応答と配信状況の記録を行うため
 */
package com.prestige.store.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.prestige.store.notification.whatsapp.WhatsAppProperties;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WhatsAppWebhookService {

  private static final Logger logger = LoggerFactory.getLogger(WhatsAppWebhookService.class);

  static final String AUTO_RESPONSE =
      "Thank you for your message! 🏆 Our team will review your inquiry and provide pricing"
          + " information within 24 hours. For immediate assistance, please call us at"
          + " +1-234-567-8900.";

  private final WhatsAppProperties properties;
  private final StoreNotificationService notificationService;

  public record WebhookSummary(int messages, int statuses, int autoReplies) {}

  /** mode=subscribe かつトークン一致のときだけ challenge を返す。 */
  public Optional<String> verify(String mode, String token, String challenge) {
    if ("subscribe".equals(mode) && properties.verifyToken().equals(token)) {
      logger.info("whatsapp webhook verified");
      return Optional.ofNullable(challenge);
    }
    logger.warn("whatsapp webhook verification failed mode={}", mode);
    return Optional.empty();
  }

  public WebhookSummary handle(JsonNode body) {
    int messages = 0;
    int statuses = 0;
    int autoReplies = 0;
    if (body == null) {
      return new WebhookSummary(0, 0, 0);
    }
    for (JsonNode entry : body.path("entry")) {
      for (JsonNode change : entry.path("changes")) {
        final JsonNode value = change.path("value");
        final JsonNode contact = value.path("contacts").path(0);
        for (JsonNode message : value.path("messages")) {
          messages++;
          try {
            if (processIncomingMessage(message, contact)) {
              autoReplies++;
            }
          } catch (RuntimeException ex) {
            // 1 件の失敗で残りの通知を取りこぼさない
            logger.warn("whatsapp webhook message handling failed id={}", message.path("id").asText(), ex);
          }
        }
        for (JsonNode status : value.path("statuses")) {
          statuses++;
          logger.info(
              "whatsapp message status id={} status={} recipient={}",
              status.path("id").asText(),
              status.path("status").asText(),
              status.path("recipient_id").asText());
        }
      }
    }
    return new WebhookSummary(messages, statuses, autoReplies);
  }

  private boolean processIncomingMessage(JsonNode message, JsonNode contact) {
    final String from = message.path("from").asText();
    final String sender = contact.path("profile").path("name").asText(from);
    final String text = message.path("text").path("body").asText("");
    logger.info(
        "whatsapp incoming message from={} type={} length={}",
        sender,
        message.path("type").asText(),
        text.length());
    final String lower = text.toLowerCase(Locale.ROOT);
    if (from.isBlank() || !(lower.contains("price") || lower.contains("quote"))) {
      return false;
    }
    notificationService.queueReply(from, AUTO_RESPONSE, "auto_reply:" + from);
    return true;
  }
}
