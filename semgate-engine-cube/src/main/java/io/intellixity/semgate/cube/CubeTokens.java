package io.intellixity.semgate.cube;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import io.intellixity.semgate.error.ConfigurationException;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtEncodingException;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Issues the HS256 bearer tokens the engine expects; {@code databaseId} routes the request engine-side. */
public final class CubeTokens {
  public static final String DATABASE_ID_CLAIM = "databaseId";

  private final JwtEncoder encoder;
  private final Duration ttl;
  private final Clock clock;

  public CubeTokens(String secret, Duration ttl, Clock clock) {
    Objects.requireNonNull(secret, "secret");
    this.encoder = new NimbusJwtEncoder(new ImmutableSecret<>(secretKey(secret)));
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static SecretKey secretKey(String secret) {
    return new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
  }

  public String issue(String databaseId) {
    Instant now = clock.instant();
    JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
        .issuedAt(now)
        .expiresAt(now.plus(ttl));
    if (databaseId != null) claims.claim(DATABASE_ID_CLAIM, databaseId);
    JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    try {
      return encoder.encode(JwtEncoderParameters.from(header, claims.build())).getTokenValue();
    } catch (JwtEncodingException e) {
      // HS256 needs a key of at least 256 bits
      throw new ConfigurationException("Cannot sign engine token: " + e.getMessage(), e);
    }
  }
}
