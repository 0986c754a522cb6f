package com.prestige.store.api.response;

import com.prestige.store.notification.BulkSendResult;
import java.util.List;

public record BulkSendResponse(int total, int sent, int failed, List<BulkSendResult> results) {

  public static BulkSendResponse of(List<BulkSendResult> results) {
    final int sent = (int) results.stream().filter(BulkSendResult::success).count();
    return new BulkSendResponse(results.size(), sent, results.size() - sent, List.copyOf(results));
  }
}
