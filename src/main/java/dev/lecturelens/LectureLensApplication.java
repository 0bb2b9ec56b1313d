package dev.lecturelens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the LectureLens citation service.
 *
 * <p>Serves REST queries under {@code /api/rag} and live transcript streams on {@code
 * /api/transcribe/stream}.
 */
@SpringBootApplication
public class LectureLensApplication {
  public static void main(String[] args) {
    SpringApplication.run(LectureLensApplication.class, args);
  }
}
