package com.prestige.store.api;

import com.prestige.store.api.request.WatchCreateRequest;
import com.prestige.store.api.request.WatchUpdateRequest;
import com.prestige.store.api.response.AdminWatchesResponse;
import com.prestige.store.api.response.MessageResponse;
import com.prestige.store.data.Row;
import com.prestige.store.model.InventoryStats;
import com.prestige.store.service.WatchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 管理画面向けの在庫 API。削除は論理削除。 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminWatchController {

  private final WatchService watchService;

  @GetMapping("/watches")
  public ResponseEntity<AdminWatchesResponse> list() {
    return ResponseEntity.ok(
        new AdminWatchesResponse(watchService.listForAdmin(), watchService.overview()));
  }

  @PostMapping("/watches")
  public ResponseEntity<Row> create(@Valid @RequestBody WatchCreateRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(watchService.create(request));
  }

  @PutMapping("/watches/{id}")
  public ResponseEntity<Row> update(
      @PathVariable("id") long id, @Valid @RequestBody WatchUpdateRequest request) {
    return ResponseEntity.ok(watchService.update(id, request));
  }

  @DeleteMapping("/watches/{id}")
  public ResponseEntity<MessageResponse> delete(@PathVariable("id") long id) {
    watchService.delete(id);
    return ResponseEntity.ok(new MessageResponse("watch deleted"));
  }

  @GetMapping("/stats")
  public ResponseEntity<InventoryStats> stats() {
    return ResponseEntity.ok(watchService.stats());
  }
}
