package com.prestige.store.api;

import com.prestige.store.api.response.SettingsResponse;
import com.prestige.store.service.SettingsService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

  private final SettingsService settingsService;

  @GetMapping
  public ResponseEntity<SettingsResponse> list() {
    return ResponseEntity.ok(settingsService.list());
  }

  @PutMapping
  public ResponseEntity<SettingsResponse.Updated> update(@RequestBody Map<String, String> values) {
    return ResponseEntity.ok(new SettingsResponse.Updated(settingsService.upsert(values)));
  }
}
