/*
 * どこで: Store 公開 API
 * 何を: 販売中の時計の一覧・詳細・ブランド別・検索を公開する
 * なぜ: 顧客向けカタログには available の時計だけを見せるため
 */
package com.prestige.store.api;

import com.prestige.store.api.response.RowListResponse;
import com.prestige.store.data.Row;
import com.prestige.store.service.WatchSearchCriteria;
import com.prestige.store.service.WatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/watches")
@RequiredArgsConstructor
public class WatchController {

  private final WatchService watchService;

  @GetMapping
  public ResponseEntity<RowListResponse> list() {
    return ResponseEntity.ok(RowListResponse.of(watchService.listAvailable()));
  }

  @GetMapping("/{id:\\d+}")
  public ResponseEntity<Row> get(@PathVariable("id") long id) {
    return ResponseEntity.ok(watchService.getAvailable(id));
  }

  @GetMapping("/brand/{brand}")
  public ResponseEntity<RowListResponse> byBrand(@PathVariable("brand") String brand) {
    return ResponseEntity.ok(RowListResponse.of(watchService.listByBrand(brand)));
  }

  @GetMapping("/search")
  public ResponseEntity<RowListResponse> search(
      @RequestParam(name = "q", required = false) String query,
      @RequestParam(name = "brand", required = false) String brand,
      @RequestParam(name = "minPrice", required = false) Long minPrice,
      @RequestParam(name = "maxPrice", required = false) Long maxPrice,
      @RequestParam(name = "condition", required = false) String condition) {
    final WatchSearchCriteria criteria =
        new WatchSearchCriteria(query, brand, minPrice, maxPrice, condition);
    return ResponseEntity.ok(RowListResponse.of(watchService.search(criteria)));
  }
}
