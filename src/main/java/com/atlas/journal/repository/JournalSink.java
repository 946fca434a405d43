package com.atlas.journal.repository;

import com.atlas.journal.dto.LocationFix;
import com.atlas.journal.dto.PhotoCluster;

/**
 * Persistence and sync target for journal data.
 *
 * <p>Implementations signal a failed delivery by throwing; callers go through the retry
 * scheduler and expect each call to be safe to repeat.
 */
public interface JournalSink {

    void append(LocationFix fix);

    void appendCluster(PhotoCluster cluster);
}
