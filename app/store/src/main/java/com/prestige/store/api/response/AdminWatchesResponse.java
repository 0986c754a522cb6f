package com.prestige.store.api.response;

import com.prestige.store.data.Row;
import com.prestige.store.model.InventoryStats;
import java.util.List;

public record AdminWatchesResponse(List<Row> data, InventoryStats.Overview stats) {

  public AdminWatchesResponse {
    data = data == null ? List.of() : List.copyOf(data);
  }
}
