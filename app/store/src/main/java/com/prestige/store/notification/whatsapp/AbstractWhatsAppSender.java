package com.prestige.store.notification.whatsapp;

import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/** 宛先の正規化と HTTP 失敗の SendException への変換を共通化する。 */
abstract class AbstractWhatsAppSender implements WhatsAppSender {

  private static final Logger logger = LoggerFactory.getLogger(AbstractWhatsAppSender.class);

  protected final Clock clock;

  protected AbstractWhatsAppSender(Clock clock) {
    this.clock = clock;
  }

  @Override
  public final SendResult send(String to, String body, @Nullable String mediaUrl) {
    if (body == null || body.isBlank()) {
      throw new IllegalArgumentException("message body is required");
    }
    return doSend(PhoneNumbers.normalize(to), body, mediaUrl);
  }

  @Override
  public final SendResult sendTemplate(String to, String templateName, List<String> params) {
    if (templateName == null || templateName.isBlank()) {
      throw new IllegalArgumentException("template name is required");
    }
    return doSendTemplate(
        PhoneNumbers.normalize(to), templateName, params == null ? List.of() : List.copyOf(params));
  }

  protected abstract SendResult doSend(String to, String body, @Nullable String mediaUrl);

  protected abstract SendResult doSendTemplate(String to, String templateName, List<String> params);

  protected SendResult result(String messageId, String status) {
    return new SendResult(messageId, status, Instant.now(clock), provider().id());
  }

  protected <T> T exchange(String operation, Supplier<T> call) {
    final String provider = provider().id();
    try {
      final T response = call.get();
      if (response == null) {
        throw new SendException(
            provider, SendException.Reason.INVALID_RESPONSE, provider + " response is empty");
      }
      return response;
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      logger.warn(
          "whatsapp {} failed provider={} status={} body={}",
          operation,
          provider,
          status,
          ex.getResponseBodyAsString());
      final SendException.Reason reason =
          ex.getStatusCode().is5xxServerError()
              ? SendException.Reason.PROVIDER_ERROR
              : SendException.Reason.REJECTED;
      throw new SendException(
          provider,
          reason,
          provider + " API error: " + status + " " + ex.getResponseBodyAsString(),
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("whatsapp {} timed out provider={}", operation, provider);
        throw new SendException(
            provider, SendException.Reason.TIMEOUT, provider + " request timeout", ex);
      }
      logger.warn("whatsapp {} connection failed provider={}", operation, provider, ex);
      throw new SendException(
          provider, SendException.Reason.CONNECTION_FAILED, provider + " connection failed", ex);
    } catch (SendException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("whatsapp {} response parse failed provider={}", operation, provider, ex);
      throw new SendException(
          provider,
          SendException.Reason.INVALID_RESPONSE,
          provider + " response parse failed",
          ex);
    }
  }

  protected static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
