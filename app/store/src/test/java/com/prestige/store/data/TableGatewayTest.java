/*
 * どこで: TableGateway の統合テスト
 * 何を: H2 (PostgreSQL モード) と Flyway マイグレーション上で CRUD の振る舞いを検証する
 * なぜ: 列の出し入れ・updated_at の打刻・失敗時の例外変換が崩れないことを保証するため
 */
package com.prestige.store.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.prestige.store.model.StoreTables;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@JdbcTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({TableGateway.class, TableGatewayTest.FixedClockConfig.class})
class TableGatewayTest {

  private static final Instant NOW = Instant.parse("2030-01-01T00:00:00Z");

  @Autowired private TableGateway tableGateway;

  @TestConfiguration
  static class FixedClockConfig {
    @Bean
    Clock clock() {
      return Clock.fixed(NOW, ZoneOffset.UTC);
    }
  }

  @Test
  void insertedRowIsReturnedBySelectOne() {
    final long id =
        tableGateway.insert(
            StoreTables.WATCHES,
            new Row()
                .put("brand", "Omega")
                .put("model", "Seamaster")
                .put("reference", "210.30.42.20.01.001")
                .put("condition", "Excellent")
                .put("price", 4200L));

    final Optional<Row> found = tableGateway.selectOne(StoreTables.WATCHES, Filter.where("id", id));

    assertThat(found).isPresent();
    assertThat(found.get().getString("brand")).isEqualTo("Omega");
    assertThat(found.get().getLong("price")).isEqualTo(4200L);
    assertThat(found.get().getString("status")).isEqualTo("available");
    assertThat(found.get().getInstant("created_at")).isNotNull();
  }

  @Test
  void selectOneReturnsEmptyWhenNothingMatches() {
    assertThat(tableGateway.selectOne(StoreTables.WATCHES, Filter.where("id", -1L))).isEmpty();
  }

  @Test
  void updateChangesOnlySuppliedColumnsAndStampsUpdatedAt() {
    final long id = insertWatch("Omega", 4200L);
    final Row before = tableGateway.selectOne(StoreTables.WATCHES, Filter.where("id", id)).get();

    final boolean changed =
        tableGateway.update(StoreTables.WATCHES, Row.of("price", 4000L), Filter.where("id", id));

    final Row after = tableGateway.selectOne(StoreTables.WATCHES, Filter.where("id", id)).get();
    assertThat(changed).isTrue();
    assertThat(after.getLong("price")).isEqualTo(4000L);
    assertThat(after.getInstant("updated_at")).isEqualTo(NOW);
    assertThat(after.getString("brand")).isEqualTo(before.getString("brand"));
    assertThat(after.getString("model")).isEqualTo(before.getString("model"));
    assertThat(after.getInstant("created_at")).isEqualTo(before.getInstant("created_at"));
  }

  @Test
  void updateIgnoresCallerSuppliedUpdatedAt() {
    final long id = insertWatch("Omega", 4200L);

    tableGateway.update(
        StoreTables.WATCHES,
        new Row().put("price", 3900L).put("updated_at", Instant.parse("2001-01-01T00:00:00Z")),
        Filter.where("id", id));

    final Row after = tableGateway.selectOne(StoreTables.WATCHES, Filter.where("id", id)).get();
    assertThat(after.getInstant("updated_at")).isEqualTo(NOW);
  }

  @Test
  void updateAndDeleteReportWhetherAnyRowMatched() {
    assertThat(
            tableGateway.update(StoreTables.WATCHES, Row.of("price", 1L), Filter.where("id", -1L)))
        .isFalse();
    assertThat(tableGateway.delete(StoreTables.WATCHES, Filter.where("id", -1L))).isFalse();

    final long id = insertWatch("Tudor", 3100L);
    assertThat(tableGateway.delete(StoreTables.WATCHES, Filter.where("id", id))).isTrue();
    assertThat(tableGateway.selectOne(StoreTables.WATCHES, Filter.where("id", id))).isEmpty();
  }

  @Test
  void updateAndDeleteRequireCriteria() {
    assertThatThrownBy(
            () -> tableGateway.update(StoreTables.WATCHES, Row.of("price", 1L), Filter.all()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("update requires at least one condition");
    assertThatThrownBy(() -> tableGateway.delete(StoreTables.WATCHES, Filter.all()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("delete requires at least one condition");
  }

  @Test
  void selectAllAppliesFilterOrderAndPaging() {
    insertWatch("Zenith", 100L);
    insertWatch("Zenith", 300L);
    insertWatch("Zenith", 200L);

    final List<Row> rows =
        tableGateway.selectAll(
            StoreTables.WATCHES,
            Filter.where("brand", Filter.Operator.EQ_IGNORE_CASE, "zenith")
                .orderBy("price", Filter.Direction.DESC)
                .limit(2));

    assertThat(rows).extracting(row -> row.getLong("price")).containsExactly(300L, 200L);
    assertThat(
            tableGateway.count(
                StoreTables.WATCHES, Filter.where("brand", "Zenith").limit(1)))
        .isEqualTo(3L);
  }

  @Test
  void constraintViolationSurfacesAsStorageException() {
    assertThatThrownBy(
            () -> tableGateway.insert(StoreTables.WATCHES, Row.of("brand", "Missing model")))
        .isInstanceOf(StorageException.class)
        .satisfies(
            ex -> {
              final StorageException storage = (StorageException) ex;
              assertThat(storage.table()).isEqualTo("watches");
              assertThat(storage.operation()).isEqualTo("insert");
            });
  }

  @Test
  void unknownColumnSurfacesAsStorageException() {
    assertThatThrownBy(
            () -> tableGateway.selectAll(StoreTables.WATCHES, Filter.where("no_such_column", 1)))
        .isInstanceOf(StorageException.class);
  }

  @Test
  void rejectsEmptyRowAndInvalidTableName() {
    assertThatThrownBy(() -> tableGateway.insert(StoreTables.WATCHES, new Row()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> tableGateway.selectAll("watches; DROP TABLE watches"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private long insertWatch(String brand, long price) {
    return tableGateway.insert(
        StoreTables.WATCHES,
        new Row()
            .put("brand", brand)
            .put("model", "Test")
            .put("reference", "REF-" + price)
            .put("condition", "Good")
            .put("price", price));
  }
}
