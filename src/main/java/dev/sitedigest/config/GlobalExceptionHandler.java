package dev.sitedigest.config;

import dev.sitedigest.crawl.InvalidSeedUrlException;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps request errors to RFC 9457 Problem Detail responses.
 *
 * <p>All mapped failures are client errors (HTTP 400). Crawl and synthesis failures past the
 * request boundary are absorbed by the pipeline and never reach this handler.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * Maps a seed URL that is not an absolute http(s) URL to 400.
   *
   * @param ex the rejected seed
   * @return a Problem Detail carrying the offending URL
   */
  @ExceptionHandler(InvalidSeedUrlException.class)
  ProblemDetail handleInvalidSeed(InvalidSeedUrlException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setTitle("Invalid seed URL");
    problem.setProperty("url", ex.getSeedUrl());
    return problem;
  }

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /**
   * Maps bean validation failures of a request body to 400, joining the field messages.
   *
   * @param ex the validation failure
   * @return a Problem Detail whose detail lists every violated constraint message
   */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
  }
}
