package com.prestige.store.api;

import com.prestige.store.api.response.HealthResponse;
import com.prestige.store.notification.queue.OutboundNotificationQueue;
import com.prestige.store.notification.whatsapp.WhatsAppSender;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** 外形監視用。詳細なヘルスチェックは actuator に任せる。 */
@RestController
@RequiredArgsConstructor
public class HealthController {

  private final OutboundNotificationQueue notificationQueue;
  private final WhatsAppSender whatsAppSender;
  private final Clock clock;

  @GetMapping("/api/health")
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(
        new HealthResponse(
            "healthy",
            Instant.now(clock),
            notificationQueue.pendingCount(),
            whatsAppSender.provider().id()));
  }
}
