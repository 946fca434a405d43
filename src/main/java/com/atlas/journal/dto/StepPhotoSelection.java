package com.atlas.journal.dto;

import java.util.List;

/**
 * Photos chosen to represent a cluster as a journal step.
 *
 * @param clusterId source cluster
 * @param photos quality-gated photos in chronological order, capped per step
 * @param featured highest scoring subset for prominent display, best first
 */
public record StepPhotoSelection(
    String clusterId, List<PhotoRecord> photos, List<PhotoRecord> featured) {}
