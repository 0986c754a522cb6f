package com.prestige.store.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.prestige.store.data.Row;
import java.util.List;

public record PagedRowsResponse(List<Row> data, Pagination pagination) {

  public PagedRowsResponse {
    data = data == null ? List.of() : List.copyOf(data);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Pagination(long total, int limit, int offset, boolean hasMore) {

    public static Pagination of(long total, int limit, int offset, int returned) {
      return new Pagination(total, limit, offset, (long) offset + returned < total);
    }
  }
}
