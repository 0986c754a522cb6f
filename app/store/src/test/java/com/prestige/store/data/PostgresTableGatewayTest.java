package com.prestige.store.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.prestige.store.model.InventoryStats;
import com.prestige.store.model.StoreTables;
import com.prestige.store.repository.StoreStatsRepository;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Testcontainers(disabledWithoutDocker = true)
class PostgresTableGatewayTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
  }

  @Autowired private TableGateway tableGateway;
  @Autowired private StoreStatsRepository statsRepository;

  @Test
  void seededCatalogIsQueryable() {
    final List<Row> omega =
        tableGateway.selectAll(
            StoreTables.WATCHES,
            Filter.where("brand", Filter.Operator.CONTAINS_IGNORE_CASE, "ome"));

    assertThat(omega)
        .singleElement()
        .satisfies(
            row -> {
              assertThat(row.getLong("price")).isEqualTo(4200L);
              assertThat(row.getInstant("created_at")).isBeforeOrEqualTo(Instant.now());
            });
  }

  @Test
  void updateStampsUpdatedAtAndDeleteRemoves() {
    final long id =
        tableGateway.insert(
            StoreTables.INQUIRIES,
            new Row()
                .put("customer_name", "Pg")
                .put("customer_email", "pg@example.com")
                .put("message", "hello"));

    assertThat(
            tableGateway.update(
                StoreTables.INQUIRIES, Row.of("status", "responded"), Filter.where("id", id)))
        .isTrue();
    assertThat(
            tableGateway
                .selectOne(StoreTables.INQUIRIES, Filter.where("id", id))
                .orElseThrow()
                .getString("status"))
        .isEqualTo("responded");
    assertThat(tableGateway.delete(StoreTables.INQUIRIES, Filter.where("id", id))).isTrue();
    assertThat(tableGateway.delete(StoreTables.INQUIRIES, Filter.where("id", id))).isFalse();
  }

  @Test
  void constraintViolationBecomesStorageException() {
    assertThatThrownBy(
            () ->
                tableGateway.insert(
                    StoreTables.WATCHES,
                    new Row()
                        .put("brand", "Broken")
                        .put("model", "Negative")
                        .put("reference", "X")
                        .put("condition", "Good")
                        .put("price", -1L)))
        .isInstanceOf(StorageException.class)
        .satisfies(ex -> assertThat(((StorageException) ex).operation()).isEqualTo("insert"));
  }

  @Test
  void statsQueriesRunOnPostgres() {
    final InventoryStats.Overview overview =
        statsRepository.inventoryOverview(Instant.now().minusSeconds(3600));

    assertThat(overview.totalWatches()).isEqualTo(4);
    assertThat(statsRepository.recentActivity(Instant.now().minusSeconds(3600), 10)).isNotEmpty();
  }
}
