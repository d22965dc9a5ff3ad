package dev.clinrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the clinrank command line.
 *
 * <p>Runs one funnel stage per invocation ({@code scout}, {@code inspect}, {@code judge}) or the
 * whole funnel ({@code run}); the process exit code reflects the outcome.
 */
@SpringBootApplication
public class ClinrankApplication {
  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(ClinrankApplication.class, args)));
  }
}
