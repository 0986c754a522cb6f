/*
 * どこで: 管理者認証のサービス層
 * 何を: ログイン・本人情報・パスワード変更・管理者追加を admin_users に対して行う
 * なぜ: パスワードは BCrypt ハッシュだけを保存し、トークン発行を一箇所に閉じるため
 */
package com.prestige.store.service;

import com.prestige.store.api.request.AdminUserCreateRequest;
import com.prestige.store.api.request.ChangePasswordRequest;
import com.prestige.store.api.response.AdminUserResponse;
import com.prestige.store.api.response.LoginResponse;
import com.prestige.store.data.Filter;
import com.prestige.store.data.Row;
import com.prestige.store.data.TableGateway;
import com.prestige.store.model.AdminRole;
import com.prestige.store.model.StoreTables;
import com.prestige.store.security.AdminPrincipal;
import com.prestige.store.security.AdminTokenService;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AdminAuthService {

  private static final Logger logger = LoggerFactory.getLogger(AdminAuthService.class);
  static final String TOKEN_TYPE = "Bearer";

  private final TableGateway tableGateway;
  private final PasswordEncoder passwordEncoder;
  private final AdminTokenService tokenService;
  private final Clock clock;

  public LoginResponse login(String username, String password) {
    final Row user =
        tableGateway
            .selectOne(StoreTables.ADMIN_USERS, Filter.where("username", username.trim()))
            .orElse(null);
    // 利用者の有無はレスポンスで区別しない
    if (user == null || !passwordEncoder.matches(password, user.getString("password_hash"))) {
      logger.warn("admin login rejected username={}", username);
      throw new InvalidCredentialsException("invalid credentials");
    }
    final long id = user.getLong("id");
    tableGateway.update(
        StoreTables.ADMIN_USERS,
        Row.of("last_login", Instant.now(clock)),
        Filter.where("id", id));
    final Row refreshed = requireUser(id);
    final AdminTokenService.IssuedToken token = tokenService.issue(refreshed);
    logger.info("admin login succeeded adminId={} role={}", id, refreshed.getString("role"));
    return new LoginResponse(
        token.value(), TOKEN_TYPE, token.expiresAt(), AdminUserResponse.from(refreshed));
  }

  public AdminUserResponse currentUser(AdminPrincipal principal) {
    return AdminUserResponse.from(requireUser(principal.id()));
  }

  public void changePassword(AdminPrincipal principal, ChangePasswordRequest request) {
    final Row user = requireUser(principal.id());
    if (!passwordEncoder.matches(request.currentPassword(), user.getString("password_hash"))) {
      throw new IllegalArgumentException("current password is incorrect");
    }
    tableGateway.update(
        StoreTables.ADMIN_USERS,
        Row.of("password_hash", passwordEncoder.encode(request.newPassword())),
        Filter.where("id", principal.id()));
    logger.info("admin password changed adminId={}", principal.id());
  }

  public AdminUserResponse createUser(AdminPrincipal actor, AdminUserCreateRequest request) {
    if (actor.role() != AdminRole.ADMIN) {
      throw new ForbiddenOperationException("insufficient permissions");
    }
    final String username = request.username().trim();
    final String email = request.email().trim();
    final AdminRole role =
        request.role() == null || request.role().isBlank()
            ? AdminRole.ADMIN
            : AdminRole.fromValue(request.role());
    final Filter duplicate =
        Filter.all()
            .anyOf(
                Filter.condition("username", Filter.Operator.EQ, username),
                Filter.condition("email", Filter.Operator.EQ_IGNORE_CASE, email));
    if (tableGateway.selectOne(StoreTables.ADMIN_USERS, duplicate).isPresent()) {
      throw new ConflictException("username or email already exists");
    }
    final long id = insertUser(username, email, request.password(), role);
    logger.info("admin user created adminId={} role={} actorId={}", id, role.value(), actor.id());
    return AdminUserResponse.from(requireUser(id));
  }

  /** 管理者が 1 人もいない場合に限り初期管理者を作る。作成したら true。 */
  public boolean ensureBootstrapAdmin(String username, String email, String password) {
    if (tableGateway.count(StoreTables.ADMIN_USERS, Filter.all()) > 0) {
      return false;
    }
    final long id = insertUser(username, email, password, AdminRole.ADMIN);
    logger.info("bootstrap admin created adminId={} username={}", id, username);
    return true;
  }

  private long insertUser(String username, String email, String password, AdminRole role) {
    return tableGateway.insert(
        StoreTables.ADMIN_USERS,
        new Row()
            .put("username", username)
            .put("email", email)
            .put("password_hash", passwordEncoder.encode(password))
            .put("role", role.value()));
  }

  private Row requireUser(long id) {
    return tableGateway
        .selectOne(StoreTables.ADMIN_USERS, Filter.where("id", id))
        .orElseThrow(() -> new InvalidCredentialsException("user not found"));
  }
}
