package com.atlas.journal.service;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.atlas.journal.algorithm.PhotoClusterEngine;
import com.atlas.journal.algorithm.QualityGate;
import com.atlas.journal.client.StepAssignmentClient;
import com.atlas.journal.dto.CurationResult;
import com.atlas.journal.dto.PhotoAnalysis;
import com.atlas.journal.dto.PhotoCluster;
import com.atlas.journal.dto.PhotoRecord;
import com.atlas.journal.dto.StepPhotoSelection;
import com.atlas.journal.exception.CurationInProgressException;
import com.atlas.journal.exception.RetryExhaustedException;
import com.atlas.journal.repository.JournalSink;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Curation run for a trip's photo library.
 *
 * <p><strong>Pipeline:</strong>
 *
 * <ol>
 *   <li>Analyses become {@link PhotoRecord}s. A photo is junk when the scorer says so, or, when the
 *       scorer gives only a junk score, when that score reaches the junk threshold.
 *   <li>Junk and low quality photos are dropped by the {@link QualityGate}.
 *   <li>The survivors are clustered by time and place.
 *   <li>Each cluster is stored through the retry scheduler and then handed to the step assignment
 *       collaborator together with its photo selection.
 * </ol>
 *
 * <p>Runs for different trips proceed in parallel; a second run for a trip that is already being
 * curated is refused.
 */
@Service
public class PhotoCurationService {

  private static final Logger logger = LoggerFactory.getLogger(PhotoCurationService.class);

  private final QualityGate qualityGate;
  private final PhotoClusterEngine clusterEngine;
  private final BatchRetryScheduler retryScheduler;
  private final JournalSink journalSink;
  private final StepAssignmentClient stepAssignmentClient;

  private final Set<String> tripsInProgress = ConcurrentHashMap.newKeySet();

  private final Counter photosProcessedCounter;
  private final Counter photosFilteredCounter;
  private final Counter clustersCreatedCounter;
  private final Timer curationTimer;

  public PhotoCurationService(
      QualityGate qualityGate,
      PhotoClusterEngine clusterEngine,
      BatchRetryScheduler retryScheduler,
      JournalSink journalSink,
      StepAssignmentClient stepAssignmentClient,
      MeterRegistry meterRegistry) {
    this.qualityGate = qualityGate;
    this.clusterEngine = clusterEngine;
    this.retryScheduler = retryScheduler;
    this.journalSink = journalSink;
    this.stepAssignmentClient = stepAssignmentClient;

    this.photosProcessedCounter =
        Counter.builder("journal.curation.photos.processed")
            .description("Number of photo analyses submitted for curation")
            .register(meterRegistry);
    this.photosFilteredCounter =
        Counter.builder("journal.curation.photos.filtered")
            .description("Number of photos dropped as junk or low quality")
            .register(meterRegistry);
    this.clustersCreatedCounter =
        Counter.builder("journal.curation.clusters.created")
            .description("Number of photo clusters created")
            .register(meterRegistry);
    this.curationTimer =
        Timer.builder("journal.curation.duration")
            .description("Time taken by a curation run")
            .register(meterRegistry);
  }

  /**
   * Curates the photos of one trip.
   *
   * @throws CurationInProgressException when the trip is already being curated
   * @throws RetryExhaustedException when a cluster cannot be stored; clusters handed off before
   *     the failure stay handed off
   */
  public CurationResult curateTripPhotos(String tripId, List<PhotoAnalysis> analyses) {
    if (!tripsInProgress.add(tripId)) {
      logger.warn("Rejecting curation for trip {}: a run is already in progress", tripId);
      throw new CurationInProgressException(tripId);
    }
    try {
      return curationTimer.record(() -> runCuration(tripId, analyses));
    } finally {
      tripsInProgress.remove(tripId);
    }
  }

  private CurationResult runCuration(String tripId, List<PhotoAnalysis> analyses) {
    if (analyses == null || analyses.isEmpty()) {
      logger.info("No photos to curate for trip {}", tripId);
      return CurationResult.empty(tripId);
    }

    List<PhotoRecord> records = analyses.stream().map(this::toRecord).collect(Collectors.toList());
    List<PhotoRecord> passed = qualityGate.filter(records);
    int filtered = records.size() - passed.size();

    photosProcessedCounter.increment(records.size());
    photosFilteredCounter.increment(filtered);
    logger.debug(
        "Trip {}: {} of {} photos passed the quality gate", tripId, passed.size(), records.size());

    List<PhotoCluster> clusters = clusterEngine.cluster(passed, tripId);
    for (PhotoCluster cluster : clusters) {
      retryScheduler.execute("cluster delivery", cluster, journalSink::appendCluster);
      stepAssignmentClient.onClusterFinalized(cluster, selectStepPhotos(cluster));
    }
    clustersCreatedCounter.increment(clusters.size());

    logger.info(
        "Curated trip {}: {} photos processed, {} added, {} filtered, {} clusters",
        tripId,
        records.size(),
        passed.size(),
        filtered,
        clusters.size());
    return new CurationResult(
        tripId, records.size(), passed.size(), filtered, clusters.size(), clusters);
  }

  /**
   * Photos to show for a cluster's step: the capped, chronological list and its featured subset.
   */
  public StepPhotoSelection selectStepPhotos(PhotoCluster cluster) {
    List<PhotoRecord> chronological =
        cluster.getPhotos().stream()
            .sorted(Comparator.comparing(PhotoRecord::timestamp))
            .collect(Collectors.toList());
    List<PhotoRecord> capped = qualityGate.capPerStep(chronological);
    return new StepPhotoSelection(cluster.getId(), capped, qualityGate.selectFeaturedForStep(capped));
  }

  public void assignClusterToStep(PhotoCluster cluster, String stepId) {
    cluster.assignToStep(stepId);
    logger.info("Cluster {} assigned to step {}", cluster.getId(), stepId);
  }

  public boolean isCurating(String tripId) {
    return tripsInProgress.contains(tripId);
  }

  private PhotoRecord toRecord(PhotoAnalysis analysis) {
    boolean junk =
        analysis.junk() != null
            ? analysis.junk()
            : analysis.junkScore() != null && qualityGate.isJunkScore(analysis.junkScore());
    return new PhotoRecord(
        analysis.id(),
        analysis.timestamp(),
        analysis.location(),
        analysis.qualityScore(),
        junk,
        analysis.width(),
        analysis.height());
  }
}
