package com.prestige.store.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BulkSendResult(String phone, boolean success, String messageId, String error) {

  public static BulkSendResult sent(String phone, String messageId) {
    return new BulkSendResult(phone, true, messageId, null);
  }

  public static BulkSendResult failed(String phone, String error) {
    return new BulkSendResult(phone, false, null, error);
  }
}
