/*
 * どこで: Store 管理者認証 API
 * 何を: ログイン・ログアウト・本人情報・パスワード変更・管理者追加を公開する
 * なぜ: 管理画面が Bearer トークンを取得し、以降の管理 API に使えるようにするため
 */
package com.prestige.store.api;

import com.prestige.store.api.request.AdminUserCreateRequest;
import com.prestige.store.api.request.ChangePasswordRequest;
import com.prestige.store.api.request.LoginRequest;
import com.prestige.store.api.response.AdminUserResponse;
import com.prestige.store.api.response.LoginResponse;
import com.prestige.store.api.response.MessageResponse;
import com.prestige.store.security.AdminPrincipal;
import com.prestige.store.service.AdminAuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

  private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

  private final AdminAuthService adminAuthService;

  @PostMapping("/login")
  public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
    return ResponseEntity.ok(adminAuthService.login(request.username(), request.password()));
  }

  @PostMapping("/logout")
  public ResponseEntity<MessageResponse> logout(@AuthenticationPrincipal Jwt jwt) {
    // トークンは失効させない。クライアント側で破棄する
    logger.info("admin logout subject={}", jwt == null ? null : jwt.getSubject());
    return ResponseEntity.ok(new MessageResponse("logout successful"));
  }

  @GetMapping("/me")
  public ResponseEntity<AdminUserResponse> me(@AuthenticationPrincipal Jwt jwt) {
    return ResponseEntity.ok(adminAuthService.currentUser(AdminPrincipal.from(jwt)));
  }

  @PostMapping("/change-password")
  public ResponseEntity<MessageResponse> changePassword(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody ChangePasswordRequest request) {
    adminAuthService.changePassword(AdminPrincipal.from(jwt), request);
    return ResponseEntity.ok(new MessageResponse("password changed"));
  }

  @PostMapping("/create-user")
  public ResponseEntity<AdminUserResponse> createUser(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody AdminUserCreateRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(adminAuthService.createUser(AdminPrincipal.from(jwt), request));
  }
}
