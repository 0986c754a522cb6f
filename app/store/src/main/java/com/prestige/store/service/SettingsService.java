package com.prestige.store.service;

import com.prestige.store.api.response.SettingsResponse;
import com.prestige.store.data.Filter;
import com.prestige.store.data.Row;
import com.prestige.store.data.TableGateway;
import com.prestige.store.model.StoreTables;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** settings テーブルのキー/値を読み書きする。未知のキーは説明文付きで追加する。 */
@Service
@RequiredArgsConstructor
public class SettingsService {

  private static final Logger logger = LoggerFactory.getLogger(SettingsService.class);
  private static final Pattern KEY = Pattern.compile("[A-Za-z0-9_.-]{1,100}");
  private static final int MAX_VALUE_LENGTH = 2000;

  private final TableGateway tableGateway;

  public SettingsResponse list() {
    final Map<String, SettingsResponse.Setting> settings = new LinkedHashMap<>();
    for (Row row :
        tableGateway.selectAll(
            StoreTables.SETTINGS, Filter.all().orderBy("setting_key", Filter.Direction.ASC))) {
      settings.put(
          row.getString("setting_key"),
          new SettingsResponse.Setting(
              row.getString("setting_value"),
              row.getString("description"),
              row.getInstant("updated_at")));
    }
    return new SettingsResponse(settings);
  }

  @Transactional
  public List<String> upsert(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("settings are required");
    }
    final List<String> updated = new ArrayList<>(values.size());
    for (Map.Entry<String, String> entry : values.entrySet()) {
      final String key = entry.getKey();
      final String value = entry.getValue();
      if (key == null || !KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("setting key is invalid: " + key);
      }
      if (value == null) {
        throw new IllegalArgumentException("setting value is required: " + key);
      }
      if (value.length() > MAX_VALUE_LENGTH) {
        throw new IllegalArgumentException("setting value is too long: " + key);
      }
      final Filter byKey = Filter.where("setting_key", key);
      if (!tableGateway.update(StoreTables.SETTINGS, Row.of("setting_value", value), byKey)) {
        tableGateway.insert(
            StoreTables.SETTINGS,
            new Row()
                .put("setting_key", key)
                .put("setting_value", value)
                .put("description", "User-defined setting: " + key));
      }
      updated.add(key);
    }
    logger.info("settings updated keys={}", updated);
    return updated;
  }
}
