package com.demonlist.leaderboard.pagination;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class NavigationLinksTest {

  @Test
  void absentLinksAreOmittedFromTheHeader() {
    final NavigationLinks links =
        new NavigationLinks(
            Optional.of("limit=50"),
            Optional.empty(),
            Optional.of("limit=50&after=50"),
            Optional.of("limit=50&after=70"));

    assertThat(links.toLinkHeader())
        .isEqualTo(
            "<?limit=50>; rel=first,<?limit=50&after=50>; rel=next,<?limit=50&after=70>; rel=last");
  }

  @Test
  void noLinksRenderAsEmptyHeader() {
    assertThat(NavigationLinks.none().toLinkHeader()).isEmpty();
  }
}
