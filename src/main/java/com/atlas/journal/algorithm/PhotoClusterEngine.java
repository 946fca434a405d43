package com.atlas.journal.algorithm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.atlas.journal.algorithm.util.GeoMath;
import com.atlas.journal.config.properties.CurationConfigurationProperties;
import com.atlas.journal.dto.GeoPoint;
import com.atlas.journal.dto.PhotoCluster;
import com.atlas.journal.dto.PhotoRecord;

/**
 * Single-pass chain clustering of photos by capture time and place.
 *
 * <p>Photos are sorted by timestamp (stable, so equal timestamps keep their input order) and
 * walked once. Each photo is compared with the <b>last photo appended</b> to the open cluster,
 * not with the cluster's first photo or its centroid, so a slow walk can chain a cluster well past
 * the time window. A photo joins when:
 *
 * <ul>
 *   <li>its time gap to the last photo is at most {@code timeClusterWindowMs}, and
 *   <li>when both photos are geotagged, their distance is at most {@code locationClusterRadiusM}.
 * </ul>
 *
 * A photo without a geotag only has to satisfy the time rule.
 *
 * <p>Stateless apart from configuration; safe to call concurrently for different trips.
 */
@Component
public class PhotoClusterEngine {

  private static final Logger logger = LoggerFactory.getLogger(PhotoClusterEngine.class);

  private static final Comparator<PhotoRecord> BY_TIMESTAMP =
      Comparator.comparing(PhotoRecord::timestamp);

  private final CurationConfigurationProperties config;

  public PhotoClusterEngine(CurationConfigurationProperties config) {
    this.config = config;
  }

  /**
   * Groups the photos into clusters in chronological order.
   *
   * @param photos photos in any order; not modified
   * @param tripId trip the clusters belong to
   * @return clusters in chronological order, empty for empty input
   */
  public List<PhotoCluster> cluster(List<PhotoRecord> photos, String tripId) {
    if (photos == null || photos.isEmpty()) {
      return List.of();
    }

    List<PhotoRecord> sorted = new ArrayList<>(photos);
    sorted.sort(BY_TIMESTAMP);

    List<PhotoCluster> clusters = new ArrayList<>();
    List<PhotoRecord> current = new ArrayList<>();

    for (PhotoRecord photo : sorted) {
      if (current.isEmpty() || belongsAfter(current.get(current.size() - 1), photo)) {
        current.add(photo);
        continue;
      }
      clusters.add(finalizeCluster(current, tripId));
      current = new ArrayList<>();
      current.add(photo);
    }
    clusters.add(finalizeCluster(current, tripId));

    logger.debug(
        "Clustered {} photos into {} clusters for trip {}", sorted.size(), clusters.size(), tripId);
    return clusters;
  }

  private boolean belongsAfter(PhotoRecord last, PhotoRecord candidate) {
    long gapMs = Duration.between(last.timestamp(), candidate.timestamp()).toMillis();
    if (gapMs > config.timeClusterWindowMs()) {
      return false;
    }
    if (last.hasLocation() && candidate.hasLocation()) {
      return GeoMath.distanceMeters(last.location(), candidate.location())
          <= config.locationClusterRadiusM();
    }
    return true;
  }

  private PhotoCluster finalizeCluster(List<PhotoRecord> photos, String tripId) {
    return new PhotoCluster(UUID.randomUUID().toString(), tripId, photos, centerOf(photos));
  }

  /**
   * Arithmetic mean of latitude and longitude over the geotagged photos.
   *
   * <p>Falls back to {@link GeoPoint#ORIGIN} when no photo carries a location.
   */
  static GeoPoint centerOf(List<PhotoRecord> photos) {
    double latSum = 0.0;
    double lonSum = 0.0;
    int count = 0;
    for (PhotoRecord photo : photos) {
      if (photo.hasLocation()) {
        latSum += photo.location().latitude();
        lonSum += photo.location().longitude();
        count++;
      }
    }
    if (count == 0) {
      return GeoPoint.ORIGIN;
    }
    return new GeoPoint(latSum / count, lonSum / count);
  }
}
