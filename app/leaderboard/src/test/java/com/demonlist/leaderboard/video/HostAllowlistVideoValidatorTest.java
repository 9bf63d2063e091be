package com.demonlist.leaderboard.video;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.demonlist.leaderboard.api.ApiErrorCode;
import com.demonlist.leaderboard.api.LeaderboardException;
import com.demonlist.leaderboard.config.VideoProperties;
import java.util.List;
import org.junit.jupiter.api.Test;

class HostAllowlistVideoValidatorTest {

  private final HostAllowlistVideoValidator validator =
      new HostAllowlistVideoValidator(new VideoProperties(List.of("www.youtube.com", "youtu.be")));

  @Test
  void acceptsAllowlistedHttpsUrlsAndDropsFragment() {
    assertThat(validator.validate("  https://WWW.YouTube.com/watch?v=abc#t=10 "))
        .isEqualTo("https://www.youtube.com/watch?v=abc");
  }

  @Test
  void rejectsPlainHttp() {
    assertThatThrownBy(() -> validator.validate("http://youtu.be/abc"))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.INVALID_VIDEO);
  }

  @Test
  void rejectsUnknownHosts() {
    assertThatThrownBy(() -> validator.validate("https://example.com/abc"))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.INVALID_VIDEO);
  }

  @Test
  void rejectsBlank() {
    assertThatThrownBy(() -> validator.validate(" "))
        .extracting(ex -> ((LeaderboardException) ex).code())
        .isEqualTo(ApiErrorCode.INVALID_VIDEO);
  }
}
