package dev.sitedigest.config;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sitedigest.crawl.InvalidSeedUrlException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

  @Test
  void invalidSeedMapsToBadRequestWithUrl() {
    ProblemDetail problem = handler.handleInvalidSeed(new InvalidSeedUrlException("ftp://x"));

    assertThat(problem.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
    assertThat(problem.getTitle()).isEqualTo("Invalid seed URL");
    assertThat(problem.getDetail()).isEqualTo("Invalid URL: ftp://x");
    assertThat(problem.getProperties()).containsEntry("url", "ftp://x");
  }

  @Test
  void illegalArgumentMapsToBadRequest() {
    ProblemDetail problem =
        handler.handleIllegalArgument(new IllegalArgumentException("depth must be >= 0"));

    assertThat(problem.getStatus()).isEqualTo(400);
    assertThat(problem.getDetail()).isEqualTo("depth must be >= 0");
  }
}
