package com.demonlist.leaderboard.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "leaderboard.auth")
@Validated
public record AuthProperties(@NotBlank String tokenSecret) {

  @Override
  public String toString() {
    return "AuthProperties[tokenSecret=***]";
  }
}
