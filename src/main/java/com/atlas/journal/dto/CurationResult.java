package com.atlas.journal.dto;

import java.util.List;

/**
 * Summary of a curation run for one trip.
 *
 * @param photosProcessed analyses received
 * @param photosAdded photos that passed the quality gate
 * @param photosFiltered photos removed as junk or low quality
 * @param clustersCreated clusters produced from the surviving photos
 */
public record CurationResult(
    String tripId,
    int photosProcessed,
    int photosAdded,
    int photosFiltered,
    int clustersCreated,
    List<PhotoCluster> clusters) {

  public static CurationResult empty(String tripId) {
    return new CurationResult(tripId, 0, 0, 0, 0, List.of());
  }
}
