package com.atlas.journal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.atlas.journal.algorithm.PhotoClusterEngine;
import com.atlas.journal.algorithm.QualityGate;
import com.atlas.journal.client.StepAssignmentClient;
import com.atlas.journal.config.properties.CurationConfigurationProperties;
import com.atlas.journal.config.properties.RetryConfigurationProperties;
import com.atlas.journal.dto.CurationResult;
import com.atlas.journal.dto.GeoPoint;
import com.atlas.journal.dto.LocationFix;
import com.atlas.journal.dto.PhotoAnalysis;
import com.atlas.journal.dto.PhotoCluster;
import com.atlas.journal.dto.PhotoRecord;
import com.atlas.journal.dto.StepPhotoSelection;
import com.atlas.journal.exception.CurationInProgressException;
import com.atlas.journal.exception.RetryExhaustedException;
import com.atlas.journal.repository.InMemoryJournalSink;
import com.atlas.journal.repository.JournalSink;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
@DisplayName("Photo Curation Service Tests")
class PhotoCurationServiceTest {

  private static final String TRIP_ID = "trip-7";
  private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");
  private static final GeoPoint MUSEUM = GeoPoint.of(40.4138, -3.6921);

  @Mock private StepAssignmentClient stepAssignmentClient;

  private InMemoryJournalSink sink;
  private SimpleMeterRegistry meterRegistry;
  private PhotoCurationService service;

  @BeforeEach
  void setUp() {
    sink = new InMemoryJournalSink();
    meterRegistry = new SimpleMeterRegistry();
    service = serviceWith(sink);
  }

  private PhotoCurationService serviceWith(JournalSink journalSink) {
    CurationConfigurationProperties config = CurationConfigurationProperties.defaults();
    return new PhotoCurationService(
        new QualityGate(config),
        new PhotoClusterEngine(config),
        new BatchRetryScheduler(RetryConfigurationProperties.defaults(), millis -> {}),
        journalSink,
        stepAssignmentClient,
        meterRegistry);
  }

  private static PhotoAnalysis analysis(
      String id, long minutes, double quality, Double junkScore, Boolean junk) {
    return new PhotoAnalysis(
        id, T0.plus(Duration.ofMinutes(minutes)), MUSEUM, quality, junkScore, junk, 4032, 3024);
  }

  private static PhotoAnalysis good(String id, long minutes, double quality) {
    return analysis(id, minutes, quality, null, false);
  }

  @Nested
  @DisplayName("Curation run")
  class CurationRunTests {

    @Test
    @DisplayName("should count processed, added, filtered photos and clusters")
    void countsResults() {
      List<PhotoAnalysis> analyses =
          List.of(
              good("a", 0, 0.9),
              good("b", 10, 0.7),
              analysis("screenshot", 15, 0.9, null, true),
              good("blurry", 20, 0.3),
              good("evening", 300, 0.8));

      CurationResult result = service.curateTripPhotos(TRIP_ID, analyses);

      assertThat(result.tripId()).isEqualTo(TRIP_ID);
      assertThat(result.photosProcessed()).isEqualTo(5);
      assertThat(result.photosAdded()).isEqualTo(3);
      assertThat(result.photosFiltered()).isEqualTo(2);
      assertThat(result.clustersCreated()).isEqualTo(2);
      assertThat(result.clusters()).hasSize(2);
      assertThat(meterRegistry.get("journal.curation.photos.filtered").counter().count())
          .isEqualTo(2.0);
    }

    @Test
    @DisplayName("should derive junk from the junk score when no verdict is given")
    void derivesJunkFromScore() {
      List<PhotoAnalysis> analyses =
          List.of(
              analysis("receipt", 0, 0.9, 0.75, null),
              analysis("landscape", 5, 0.9, 0.5, null),
              analysis("verdict-wins", 10, 0.9, 0.95, false));

      CurationResult result = service.curateTripPhotos(TRIP_ID, analyses);

      assertThat(result.photosFiltered()).isEqualTo(1);
      assertThat(result.clusters().get(0).getPhotos())
          .extracting(PhotoRecord::id)
          .containsExactly("landscape", "verdict-wins");
    }

    @Test
    @DisplayName("should store clusters and hand them to step assignment")
    void storesAndHandsOff() {
      CurationResult result =
          service.curateTripPhotos(TRIP_ID, List.of(good("a", 0, 0.9), good("b", 5, 0.85)));

      PhotoCluster cluster = result.clusters().get(0);
      assertThat(sink.getClusters()).containsExactly(cluster);

      ArgumentCaptor<StepPhotoSelection> selection =
          ArgumentCaptor.forClass(StepPhotoSelection.class);
      verify(stepAssignmentClient).onClusterFinalized(eq(cluster), selection.capture());
      assertThat(selection.getValue().clusterId()).isEqualTo(cluster.getId());
      assertThat(selection.getValue().featured()).extracting(PhotoRecord::id).containsExactly("a", "b");
    }

    @Test
    @DisplayName("should return an empty result for no photos")
    void emptyRun() {
      assertThat(service.curateTripPhotos(TRIP_ID, List.of())).isEqualTo(CurationResult.empty(TRIP_ID));
      verify(stepAssignmentClient, never()).onClusterFinalized(any(), any());
    }

    @Test
    @DisplayName("should propagate an exhausted cluster delivery and release the trip")
    void sinkFailure() {
      JournalSink brokenSink =
          new JournalSink() {
            @Override
            public void append(LocationFix fix) {}

            @Override
            public void appendCluster(PhotoCluster cluster) {
              throw new IllegalStateException("storage full");
            }
          };
      PhotoCurationService failing = serviceWith(brokenSink);

      assertThatThrownBy(() -> failing.curateTripPhotos(TRIP_ID, List.of(good("a", 0, 0.9))))
          .isInstanceOf(RetryExhaustedException.class)
          .hasRootCauseMessage("storage full");

      assertThat(failing.isCurating(TRIP_ID)).isFalse();
      verify(stepAssignmentClient, never()).onClusterFinalized(any(), any());
    }
  }

  @Nested
  @DisplayName("Per-trip guard")
  class GuardTests {

    @Test
    @DisplayName("should refuse a second run for the same trip but not for another trip")
    void refusesConcurrentRunForSameTrip() throws Exception {
      CountDownLatch handOffStarted = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      doAnswer(
              invocation -> {
                PhotoCluster cluster = invocation.getArgument(0);
                if (TRIP_ID.equals(cluster.getTripId())) {
                  handOffStarted.countDown();
                  release.await(5, TimeUnit.SECONDS);
                }
                return null;
              })
          .when(stepAssignmentClient)
          .onClusterFinalized(any(), any());

      ExecutorService executor = Executors.newSingleThreadExecutor();
      try {
        Future<CurationResult> first =
            executor.submit(() -> service.curateTripPhotos(TRIP_ID, List.of(good("a", 0, 0.9))));
        assertThat(handOffStarted.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.isCurating(TRIP_ID)).isTrue();
        assertThatThrownBy(() -> service.curateTripPhotos(TRIP_ID, List.of(good("b", 0, 0.9))))
            .isInstanceOf(CurationInProgressException.class);
        assertThat(service.curateTripPhotos("other-trip", List.of(good("c", 0, 0.9))).clustersCreated())
            .isEqualTo(1);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).clustersCreated()).isEqualTo(1);
        assertThat(service.isCurating(TRIP_ID)).isFalse();
      } finally {
        release.countDown();
        executor.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("Step photos")
  class StepPhotoTests {

    @Test
    @DisplayName("should cap chronologically and feature the best photos above the threshold")
    void selectsStepPhotos() {
      List<PhotoRecord> photos = new ArrayList<>();
      for (int i = 11; i >= 0; i--) {
        double quality = i == 3 ? 0.95 : i == 7 ? 0.9 : i == 9 ? 0.85 : 0.6;
        photos.add(
            new PhotoRecord("p" + i, T0.plus(Duration.ofMinutes(i)), MUSEUM, quality, false, 1, 1));
      }
      PhotoCluster cluster = new PhotoCluster("cluster-1", TRIP_ID, photos, MUSEUM);

      StepPhotoSelection selection = service.selectStepPhotos(cluster);

      assertThat(selection.photos())
          .extracting(PhotoRecord::id)
          .containsExactly("p0", "p1", "p2", "p3", "p4", "p5", "p6", "p7", "p8", "p9");
      assertThat(selection.featured()).extracting(PhotoRecord::id).containsExactly("p3", "p7", "p9");
    }

    @Test
    @DisplayName("should assign a cluster to a step")
    void assignsStep() {
      PhotoCluster cluster =
          new PhotoCluster(
              "cluster-1",
              TRIP_ID,
              List.of(new PhotoRecord("p", T0, null, 0.9, false, 1, 1)),
              GeoPoint.ORIGIN);

      service.assignClusterToStep(cluster, "step-3");

      assertThat(cluster.getAssignedStepId()).isEqualTo("step-3");
    }
  }
}
