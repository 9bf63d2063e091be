/*
 * どこで: 動画 URL の検証
 * 何を: https かつ許可ホストの URL だけを受け付け、前後空白とフラグメントを除いた形に整える
 * なぜ: 提出/パッチで保存される動画 URL を既知の配信サイトに限定するため
 */
package com.demonlist.leaderboard.video;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.config.VideoProperties;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class HostAllowlistVideoValidator implements VideoValidator {

  private final Set<String> allowedHosts;

  public HostAllowlistVideoValidator(VideoProperties properties) {
    this.allowedHosts =
        properties.allowedHosts().stream()
            .map(host -> host.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
  }

  @Override
  public String validate(String rawUrl) {
    if (rawUrl == null || rawUrl.isBlank()) {
      throw invalid(rawUrl);
    }
    final UriComponents uri;
    try {
      uri = UriComponentsBuilder.fromUriString(rawUrl.trim()).build();
    } catch (IllegalArgumentException ex) {
      throw new LeaderboardException(ApiErrorCode.INVALID_VIDEO, "malformed video url", ex);
    }
    final String host = uri.getHost();
    if (!"https".equalsIgnoreCase(uri.getScheme())
        || host == null
        || !allowedHosts.contains(host.toLowerCase(Locale.ROOT))) {
      throw invalid(rawUrl);
    }
    return UriComponentsBuilder.newInstance()
        .uriComponents(uri)
        .scheme("https")
        .host(host.toLowerCase(Locale.ROOT))
        .fragment(null)
        .build()
        .toUriString();
  }

  private LeaderboardException invalid(String rawUrl) {
    return new LeaderboardException(
        ApiErrorCode.INVALID_VIDEO, "unsupported video url: " + rawUrl);
  }
}
