package com.prestige.store.notification.whatsapp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Clock;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

/** Twilio Messages API 経由の送信。テンプレートは本文へ展開して通常メッセージで送る。 */
public class TwilioWhatsAppSender extends AbstractWhatsAppSender {

  private static final String MESSAGES_PATH = "/2010-04-01/Accounts/{accountSid}/Messages.json";

  private final RestClient restClient;
  private final WhatsAppProperties.Twilio properties;

  public TwilioWhatsAppSender(
      RestClient restClient, WhatsAppProperties.Twilio properties, Clock clock) {
    super(clock);
    this.restClient = restClient;
    this.properties = properties;
  }

  @Override
  public WhatsAppProvider provider() {
    return WhatsAppProvider.TWILIO;
  }

  @Override
  protected SendResult doSend(String to, String body, @Nullable String mediaUrl) {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("From", properties.fromNumber());
    form.add("To", "whatsapp:" + to);
    form.add("Body", body);
    if (!isBlank(mediaUrl)) {
      form.add("MediaUrl", mediaUrl);
    }
    final TwilioMessageResponse response =
        exchange(
            "send",
            () ->
                restClient
                    .post()
                    .uri(MESSAGES_PATH, properties.accountSid())
                    .headers(
                        headers ->
                            headers.setBasicAuth(properties.accountSid(), properties.authToken()))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(TwilioMessageResponse.class));
    if (isBlank(response.sid())) {
      throw new SendException(
          provider().id(), SendException.Reason.INVALID_RESPONSE, "twilio response has no sid");
    }
    return result(response.sid(), isBlank(response.status()) ? "queued" : response.status());
  }

  @Override
  protected SendResult doSendTemplate(String to, String templateName, List<String> params) {
    return doSend(
        to, "Template: " + templateName + " with params: " + String.join(", ", params), null);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TwilioMessageResponse(String sid, String status) {}
}
