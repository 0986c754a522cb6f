package com.prestige.store.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.prestige.store.data.Row;
import java.time.Instant;

/** password_hash を含めない管理ユーザー表現。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdminUserResponse(
    long id, String username, String email, String role, Instant lastLogin, Instant createdAt) {

  public static AdminUserResponse from(Row row) {
    return new AdminUserResponse(
        row.getLong("id"),
        row.getString("username"),
        row.getString("email"),
        row.getString("role"),
        row.getInstant("last_login"),
        row.getInstant("created_at"));
  }
}
