package com.prestige.store.notification.whatsapp;

import com.prestige.store.notification.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/** 外部 API を呼ばずにログへ出すだけの送信。開発環境と認証情報未設定時に使う。 */
public class MockWhatsAppSender extends AbstractWhatsAppSender {

  private static final Logger logger = LoggerFactory.getLogger(MockWhatsAppSender.class);
  private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

  private final Duration latency;
  private final Sleeper sleeper;

  public MockWhatsAppSender(Duration latency, Sleeper sleeper, Clock clock) {
    super(clock);
    this.latency = latency;
    this.sleeper = sleeper;
  }

  @Override
  public WhatsAppProvider provider() {
    return WhatsAppProvider.MOCK;
  }

  @Override
  protected SendResult doSend(String to, String body, @Nullable String mediaUrl) {
    logger.info(
        "whatsapp mock send to={} length={} media={}", to, body.length(), mediaUrl != null);
    logger.debug("whatsapp mock body={}", body);
    simulateLatency();
    return result(newMessageId(), "sent");
  }

  @Override
  protected SendResult doSendTemplate(String to, String templateName, List<String> params) {
    logger.info("whatsapp mock template to={} template={} params={}", to, templateName, params);
    simulateLatency();
    return result(newMessageId(), "sent");
  }

  private void simulateLatency() {
    try {
      sleeper.sleep(latency);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SendException(
          provider().id(), SendException.Reason.CONNECTION_FAILED, "mock send interrupted", ex);
    }
  }

  private String newMessageId() {
    final ThreadLocalRandom random = ThreadLocalRandom.current();
    final StringBuilder suffix = new StringBuilder(9);
    for (int i = 0; i < 9; i++) {
      suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
    }
    return "mock_" + clock.millis() + "_" + suffix;
  }
}
