package com.atlas.journal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

import lombok.extern.slf4j.Slf4j;

/**
 * Main Spring Boot application class for the Atlas Journal Engine.
 *
 * <p>Hosts the two engines behind a travel journal: the adaptive location tracker, which decides
 * when to sample position and detects visits, and the photo curation engine, which clusters photo
 * metadata by time and place and filters it by quality.
 *
 * @see com.atlas.journal.service.AdaptiveSampler
 * @see com.atlas.journal.service.PhotoCurationService
 */
@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class AtlasJournalEngineApplication {

  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(AtlasJournalEngineApplication.class);

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(() -> log.info("Shutting down Atlas Journal Engine gracefully...")));

    try {
      app.run(args);
    } catch (Exception e) {
      log.error("Failed to start Atlas Journal Engine", e);
      System.exit(1);
    }
  }

  /** Logs the effective tracking and curation settings once the context is ready. */
  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady(ApplicationReadyEvent event) {
    Environment env = event.getApplicationContext().getEnvironment();

    log.info("=========================================");
    log.info("Atlas Journal Engine Started Successfully");
    log.info("=========================================");
    log.info("Application Name: {}", env.getProperty("spring.application.name"));
    log.info("Server Port: {}", env.getProperty("server.port", "8080"));
    log.info(
        "Sampling Intervals: active={}ms, stationary={}ms",
        env.getProperty("journal.tracking.active-interval-ms"),
        env.getProperty("journal.tracking.stationary-interval-ms"));
    log.info(
        "Cluster Window: {}ms within {}m",
        env.getProperty("journal.curation.time-cluster-window-ms"),
        env.getProperty("journal.curation.location-cluster-radius-m"));
    log.info(
        "Sink Retries: {} (base delay {}ms)",
        env.getProperty("journal.retry.max-retries"),
        env.getProperty("journal.retry.retry-base-delay-ms"));
    log.info("=========================================");
  }
}
