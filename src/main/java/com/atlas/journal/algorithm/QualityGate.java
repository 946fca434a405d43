package com.atlas.journal.algorithm;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.atlas.journal.config.properties.CurationConfigurationProperties;
import com.atlas.journal.dto.PhotoRecord;

/**
 * Score thresholds and subset selection for curated photos.
 *
 * <p>All operations are total: empty input gives empty output, and input lists are never
 * modified.
 */
@Component
public class QualityGate {

  private static final Comparator<PhotoRecord> BY_QUALITY_DESCENDING =
      Comparator.comparingDouble(PhotoRecord::qualityScore).reversed();

  private final CurationConfigurationProperties config;

  public QualityGate(CurationConfigurationProperties config) {
    this.config = config;
  }

  /** A photo passes when it is not junk and meets the minimum quality score. */
  public boolean passes(PhotoRecord photo) {
    return !photo.junk() && photo.qualityScore() >= config.minQualityScore();
  }

  public List<PhotoRecord> filter(List<PhotoRecord> photos) {
    return photos.stream().filter(this::passes).collect(Collectors.toList());
  }

  /** Verdict for a scorer that reports a junk score without classifying the photo. */
  public boolean isJunkScore(double junkScore) {
    return junkScore >= config.junkThreshold();
  }

  /**
   * Highest scoring photos, best first. Equal scores keep their input order.
   *
   * @param k how many to return
   */
  public List<PhotoRecord> selectFeatured(List<PhotoRecord> photos, int k) {
    return photos.stream()
        .sorted(BY_QUALITY_DESCENDING)
        .limit(Math.max(k, 0))
        .collect(Collectors.toList());
  }

  public List<PhotoRecord> selectFeatured(List<PhotoRecord> photos) {
    return selectFeatured(photos, config.featuredPerStep());
  }

  /**
   * Featured photos for a step: only photos at or above the featured threshold are eligible.
   */
  public List<PhotoRecord> selectFeaturedForStep(List<PhotoRecord> photos) {
    List<PhotoRecord> eligible =
        photos.stream()
            .filter(photo -> photo.qualityScore() >= config.featuredThreshold())
            .collect(Collectors.toList());
    return selectFeatured(eligible, config.featuredPerStep());
  }

  /**
   * Quality-gates the photos and keeps the first {@code max} in the caller's order.
   */
  public List<PhotoRecord> capPerStep(List<PhotoRecord> photos, int max) {
    return photos.stream()
        .filter(this::passes)
        .limit(Math.max(max, 0))
        .collect(Collectors.toList());
  }

  public List<PhotoRecord> capPerStep(List<PhotoRecord> photos) {
    return capPerStep(photos, config.maxPhotosPerStep());
  }
}
