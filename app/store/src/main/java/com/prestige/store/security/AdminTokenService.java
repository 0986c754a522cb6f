package com.prestige.store.security;

import com.prestige.store.config.AdminAuthProperties;
import com.prestige.store.data.Row;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

/** 管理者向けの HS256 アクセストークンを発行する。subject は admin_users.id。 */
@Service
@RequiredArgsConstructor
public class AdminTokenService {

  public static final String CLAIM_USERNAME = "username";
  public static final String CLAIM_EMAIL = "email";
  public static final String CLAIM_ROLE = "role";

  private final JwtEncoder jwtEncoder;
  private final AdminAuthProperties properties;
  private final Clock clock;

  public IssuedToken issue(Row adminUser) {
    final Instant issuedAt = Instant.now(clock);
    final Instant expiresAt = issuedAt.plus(properties.tokenTtl());
    final JwtClaimsSet claims =
        JwtClaimsSet.builder()
            .issuer(properties.issuer())
            .subject(String.valueOf(adminUser.getLong("id")))
            .issuedAt(issuedAt)
            .expiresAt(expiresAt)
            .claim(CLAIM_USERNAME, adminUser.getString("username"))
            .claim(CLAIM_EMAIL, adminUser.getString("email"))
            .claim(CLAIM_ROLE, adminUser.getString("role"))
            .build();
    final JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    final String token =
        jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    return new IssuedToken(token, expiresAt);
  }

  public record IssuedToken(String value, Instant expiresAt) {}
}
