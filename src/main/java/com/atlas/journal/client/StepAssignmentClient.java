package com.atlas.journal.client;

import com.atlas.journal.dto.DwellEvent;
import com.atlas.journal.dto.PhotoCluster;
import com.atlas.journal.dto.StepPhotoSelection;

/**
 * Journal step owner. Receives finalized photo clusters and dwell transitions; the engines never
 * create steps themselves.
 */
public interface StepAssignmentClient {

    void onClusterFinalized(PhotoCluster cluster, StepPhotoSelection selection);

    void onDwellEvent(DwellEvent event);
}
