package dev.aurum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Aurum golden repository service.
 *
 * <p>Starts the refresh scheduler and the snapshot cleanup loop; both are Spring lifecycle beans
 * and stop with the context.
 */
@SpringBootApplication
public class AurumApplication {
  public static void main(String[] args) {
    SpringApplication.run(AurumApplication.class, args);
  }
}
