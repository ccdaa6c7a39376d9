package dev.sitedigest.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FrontierTest {

  @Test
  void seededFrontierHoldsSeedAtDepthZero() {
    Frontier frontier = Frontier.seededWith("https://example.com/");

    assertThat(frontier.pendingCount()).isEqualTo(1);
    assertThat(frontier.poll()).isEqualTo(new FrontierEntry("https://example.com/", 0));
    assertThat(frontier.isEmpty()).isTrue();
    assertThat(frontier.poll()).isNull();
  }

  @Test
  void entriesAreDequeuedInInsertionOrder() {
    Frontier frontier = Frontier.seededWith("https://example.com/");
    frontier.enqueueIfUnvisited("https://example.com/a", 1);
    frontier.enqueueIfUnvisited("https://example.com/b", 1);

    assertThat(frontier.poll().url()).isEqualTo("https://example.com/");
    assertThat(frontier.poll().url()).isEqualTo("https://example.com/a");
    assertThat(frontier.poll().url()).isEqualTo("https://example.com/b");
  }

  @Test
  void markVisitedClaimsUrlOnlyOnce() {
    Frontier frontier = new Frontier();

    assertThat(frontier.markVisited("https://example.com/a")).isTrue();
    assertThat(frontier.markVisited("https://example.com/a")).isFalse();
    assertThat(frontier.isVisited("https://example.com/a")).isTrue();
    assertThat(frontier.visitedCount()).isEqualTo(1);
  }

  @Test
  void visitedUrlsAreNotEnqueuedAgain() {
    Frontier frontier = new Frontier();
    frontier.markVisited("https://example.com/a");

    assertThat(frontier.enqueueIfUnvisited("https://example.com/a", 1)).isFalse();
    assertThat(frontier.enqueueIfUnvisited("https://example.com/b", 1)).isTrue();
    assertThat(frontier.pendingCount()).isEqualTo(1);
  }

  @Test
  void entryRejectsBlankUrlAndNegativeDepth() {
    assertThatThrownBy(() -> new FrontierEntry(" ", 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new FrontierEntry("https://example.com/", -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
