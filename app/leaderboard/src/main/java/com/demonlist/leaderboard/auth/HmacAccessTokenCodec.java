/*
 * どこで: 認証
 * 何を: HS256 で署名したコンパクト形式 (header.claims.signature) のアクセストークンを発行/検証する
 * なぜ: 署名鍵にパスワードハッシュを混ぜ、パスワード変更だけで既存トークンを失効させるため
 */
package com.demonlist.leaderboard.auth;

import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.config.AuthProperties;
import com.demonlist.leaderboard.model.UserRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper/Clock は Spring 管理の共有コンポーネントのため")
public class HmacAccessTokenCodec implements AccessTokenCodec {

  private static final String ALGORITHM = "HmacSHA256";
  private static final String HEADER = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private final AuthProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public HmacAccessTokenCodec(AuthProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public String issue(UserRecord user) {
    final TokenClaims claims = new TokenClaims(user.id(), clock.instant().getEpochSecond());
    final String payload;
    try {
      payload = encode(objectMapper.writeValueAsBytes(claims));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize token claims", ex);
    }
    final String signingInput = encode(HEADER.getBytes(StandardCharsets.UTF_8)) + "." + payload;
    return signingInput + "." + encode(sign(signingInput, user));
  }

  @Override
  public int decodeUnverifiedId(String token) {
    return claims(split(token)).id();
  }

  @Override
  public boolean verify(String token, UserRecord user) {
    final String[] parts;
    final TokenClaims claims;
    final byte[] signature;
    try {
      parts = split(token);
      claims = claims(parts);
      signature = DECODER.decode(parts[2]);
    } catch (LeaderboardException | IllegalArgumentException ex) {
      return false;
    }
    if (claims.id() != user.id()) {
      return false;
    }
    final byte[] expected = sign(parts[0] + "." + parts[1], user);
    return MessageDigest.isEqual(expected, signature);
  }

  private String[] split(String token) {
    if (token == null) {
      throw LeaderboardException.unauthorized();
    }
    final String[] parts = token.split("\\.", -1);
    if (parts.length != 3) {
      throw LeaderboardException.unauthorized();
    }
    return parts;
  }

  private TokenClaims claims(String[] parts) {
    try {
      return objectMapper.readValue(DECODER.decode(parts[1]), TokenClaims.class);
    } catch (IOException | IllegalArgumentException ex) {
      throw LeaderboardException.unauthorized();
    }
  }

  private byte[] sign(String signingInput, UserRecord user) {
    final String key = properties.tokenSecret() + ":" + user.passwordHash();
    try {
      final Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("HmacSHA256 not available", ex);
    }
  }

  private static String encode(byte[] bytes) {
    return ENCODER.encodeToString(bytes);
  }

  record TokenClaims(int id, long iat) {}
}
