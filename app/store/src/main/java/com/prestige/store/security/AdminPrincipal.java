package com.prestige.store.security;

import com.prestige.store.model.AdminRole;
import com.prestige.store.service.InvalidCredentialsException;
import org.springframework.security.oauth2.jwt.Jwt;

/** 検証済みトークンから取り出した管理者の識別情報。 */
public record AdminPrincipal(long id, String username, AdminRole role) {

  public static AdminPrincipal from(Jwt jwt) {
    if (jwt == null) {
      throw new InvalidCredentialsException("authentication is required");
    }
    final long id;
    try {
      id = Long.parseLong(jwt.getSubject());
    } catch (NumberFormatException ex) {
      throw new InvalidCredentialsException("token subject is invalid");
    }
    return new AdminPrincipal(
        id,
        jwt.getClaimAsString(AdminTokenService.CLAIM_USERNAME),
        AdminRole.fromValue(jwt.getClaimAsString(AdminTokenService.CLAIM_ROLE)));
  }
}
