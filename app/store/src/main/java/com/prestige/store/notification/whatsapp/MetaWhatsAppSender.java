package com.prestige.store.notification.whatsapp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Clock;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.web.client.RestClient;

/** Meta WhatsApp Cloud API 経由の送信。 */
public class MetaWhatsAppSender extends AbstractWhatsAppSender {

  private static final String MESSAGES_PATH = "/{apiVersion}/{phoneNumberId}/messages";
  private static final String MESSAGING_PRODUCT = "whatsapp";

  private final RestClient restClient;
  private final WhatsAppProperties.Meta properties;

  public MetaWhatsAppSender(RestClient restClient, WhatsAppProperties.Meta properties, Clock clock) {
    super(clock);
    this.restClient = restClient;
    this.properties = properties;
  }

  @Override
  public WhatsAppProvider provider() {
    return WhatsAppProvider.META;
  }

  @Override
  protected SendResult doSend(String to, String body, @Nullable String mediaUrl) {
    // Cloud API のテキスト送信は media を持たない。画像は別の type で送る必要がある
    final MessageRequest request =
        new MessageRequest(MESSAGING_PRODUCT, to, "text", new Text(body), null);
    return post("send", request);
  }

  @Override
  protected SendResult doSendTemplate(String to, String templateName, List<String> params) {
    final List<Component> components =
        params.isEmpty()
            ? List.of()
            : List.of(
                new Component(
                    "body", params.stream().map(param -> new Parameter("text", param)).toList()));
    final MessageRequest request =
        new MessageRequest(
            MESSAGING_PRODUCT,
            to,
            "template",
            null,
            new Template(templateName, new Language("en_US"), components));
    return post("sendTemplate", request);
  }

  private SendResult post(String operation, MessageRequest request) {
    final MessageResponse response =
        exchange(
            operation,
            () ->
                restClient
                    .post()
                    .uri(MESSAGES_PATH, properties.apiVersion(), properties.phoneNumberId())
                    .headers(headers -> headers.setBearerAuth(properties.accessToken()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(MessageResponse.class));
    if (response.messages() == null
        || response.messages().isEmpty()
        || isBlank(response.messages().get(0).id())) {
      throw new SendException(
          provider().id(), SendException.Reason.INVALID_RESPONSE, "meta response has no message id");
    }
    return result(response.messages().get(0).id(), "sent");
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  record MessageRequest(
      String messagingProduct, String to, String type, Text text, Template template) {}

  record Text(String body) {}

  record Template(String name, Language language, List<Component> components) {}

  record Language(String code) {}

  record Component(String type, List<Parameter> parameters) {}

  record Parameter(String type, String text) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MessageResponse(List<MessageId> messages) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MessageId(String id) {}
}
