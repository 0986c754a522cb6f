/*
 * どこで: Store WhatsApp API
 * 何を: 管理者の単発/一括送信、設定確認、Meta Webhook の検証と受信を公開する
 * なぜ: 送信経路と受信経路を一つの入口にまとめるため
 */
package com.prestige.store.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.prestige.store.api.request.WhatsAppBulkRequest;
import com.prestige.store.api.request.WhatsAppSendRequest;
import com.prestige.store.api.response.BulkSendResponse;
import com.prestige.store.notification.StoreNotificationService;
import com.prestige.store.notification.WhatsAppWebhookService;
import com.prestige.store.notification.whatsapp.SendResult;
import com.prestige.store.notification.whatsapp.WhatsAppConfigInspector;
import com.prestige.store.notification.whatsapp.WhatsAppConfigStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/whatsapp")
@RequiredArgsConstructor
public class WhatsAppController {

  private static final Logger logger = LoggerFactory.getLogger(WhatsAppController.class);

  private final StoreNotificationService notificationService;
  private final WhatsAppWebhookService webhookService;
  private final WhatsAppConfigInspector configInspector;

  @PostMapping("/send")
  public ResponseEntity<SendResult> send(@Valid @RequestBody WhatsAppSendRequest request) {
    return ResponseEntity.ok(
        notificationService.sendDirect(request.to(), request.message(), request.mediaUrl()));
  }

  @PostMapping("/bulk")
  public ResponseEntity<BulkSendResponse> bulk(@Valid @RequestBody WhatsAppBulkRequest request) {
    return ResponseEntity.ok(
        BulkSendResponse.of(
            notificationService.sendBulk(request.recipients(), request.defaultMessage())));
  }

  @GetMapping("/config")
  public ResponseEntity<WhatsAppConfigStatus> config() {
    return ResponseEntity.ok(configInspector.inspect());
  }

  @GetMapping(value = "/webhook", produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> verifyWebhook(
      @RequestParam(name = "hub.mode", required = false) String mode,
      @RequestParam(name = "hub.verify_token", required = false) String token,
      @RequestParam(name = "hub.challenge", required = false) String challenge) {
    return webhookService
        .verify(mode, token, challenge)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.status(HttpStatus.FORBIDDEN).body("Forbidden"));
  }

  @PostMapping("/webhook")
  public ResponseEntity<Void> receiveWebhook(@RequestBody(required = false) JsonNode body) {
    final WhatsAppWebhookService.WebhookSummary summary = webhookService.handle(body);
    logger.debug(
        "whatsapp webhook handled messages={} statuses={} autoReplies={}",
        summary.messages(),
        summary.statuses(),
        summary.autoReplies());
    return ResponseEntity.ok().build();
  }
}
