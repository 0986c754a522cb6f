package com.prestige.store.api.response;

import com.prestige.store.data.Row;
import java.util.List;

public record RowListResponse(List<Row> data, int count) {

  public RowListResponse {
    data = data == null ? List.of() : List.copyOf(data);
  }

  public static RowListResponse of(List<Row> rows) {
    return new RowListResponse(rows, rows.size());
  }
}
