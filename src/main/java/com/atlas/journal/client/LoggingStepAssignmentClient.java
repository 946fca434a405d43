package com.atlas.journal.client;

import com.atlas.journal.dto.DwellEvent;
import com.atlas.journal.dto.PhotoCluster;
import com.atlas.journal.dto.StepPhotoSelection;

import lombok.extern.slf4j.Slf4j;

/**
 * Step assignment collaborator used when no journal backend is wired in. Logs each hand-off.
 */
@Slf4j
public class LoggingStepAssignmentClient implements StepAssignmentClient {

    @Override
    public void onClusterFinalized(PhotoCluster cluster, StepPhotoSelection selection) {
        log.info("Cluster {} finalized for trip {}: {} photos ({} selected, {} featured) from {} to {}",
                cluster.getId(), cluster.getTripId(), cluster.size(), selection.photos().size(),
                selection.featured().size(), cluster.getStartTime(), cluster.getEndTime());
    }

    @Override
    public void onDwellEvent(DwellEvent event) {
        log.info("Dwell event {} for trip {} at ({}, {}) after {}s",
                event.kind(), event.tripId(), event.location().latitude(),
                event.location().longitude(), event.duration().toSeconds());
    }
}
