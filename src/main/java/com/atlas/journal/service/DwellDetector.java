package com.atlas.journal.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.atlas.journal.config.properties.TrackingConfigurationProperties;
import com.atlas.journal.dto.DwellEvent;
import com.atlas.journal.dto.DwellStage;
import com.atlas.journal.dto.LocationFix;
import com.atlas.journal.dto.MotionState;

import lombok.extern.slf4j.Slf4j;

/**
 * Detects visits from the stream of classified fixes.
 *
 * <p>A stationary period starts with the first STATIONARY fix and lasts until a fix with any
 * other activity. Elapsed time is measured between fix timestamps:
 *
 * <ul>
 *   <li>{@code >= shortStopMs}: the stop becomes a visit candidate
 *   <li>{@code >= minDwellMs}: the visit is confirmed
 * </ul>
 *
 * A period that reached at least the candidate stage ends with {@code VISIT_ENDED} once movement
 * resumes. At most one event is emitted per fix; a period that crosses both thresholds between
 * two fixes goes straight to {@code VISIT_CONFIRMED}.
 */
@Slf4j
@Component
public class DwellDetector {

    private final long shortStopMs;
    private final long minDwellMs;

    public DwellDetector(TrackingConfigurationProperties config) {
        this.shortStopMs = config.shortStopMs();
        this.minDwellMs = config.minDwellMs();
    }

    /**
     * Updates the session's dwell state with a freshly recorded fix.
     *
     * @return the transition this fix caused, if any
     */
    public Optional<DwellEvent> evaluate(TrackingSession session, LocationFix fix) {
        if (fix.getActivity() != MotionState.STATIONARY) {
            return endDwell(session, fix);
        }

        if (session.getDwellStartedAt() == null) {
            session.beginDwell(fix.getTimestamp(), fix.getPoint());
            log.debug("Stationary period started for trip {} at {}", session.getTripId(), fix.getTimestamp());
            return Optional.empty();
        }

        long elapsedMs = Duration.between(session.getDwellStartedAt(), fix.getTimestamp()).toMillis();
        DwellStage stage = session.getDwellStage();

        if (elapsedMs >= minDwellMs && stage != DwellStage.CONFIRMED) {
            session.advanceDwell(DwellStage.CONFIRMED);
            log.info("Visit confirmed for trip {} after {}s", session.getTripId(), elapsedMs / 1000);
            return Optional.of(event(session, DwellEvent.Kind.VISIT_CONFIRMED, fix.getTimestamp()));
        }
        if (elapsedMs >= shortStopMs && stage == DwellStage.NONE) {
            session.advanceDwell(DwellStage.CANDIDATE);
            log.info("Visit candidate for trip {} after {}s", session.getTripId(), elapsedMs / 1000);
            return Optional.of(event(session, DwellEvent.Kind.VISIT_CANDIDATE, fix.getTimestamp()));
        }
        return Optional.empty();
    }

    private Optional<DwellEvent> endDwell(TrackingSession session, LocationFix fix) {
        if (session.getDwellStartedAt() == null) {
            return Optional.empty();
        }
        Optional<DwellEvent> ended = Optional.empty();
        if (session.getDwellStage() != DwellStage.NONE) {
            ended = Optional.of(event(session, DwellEvent.Kind.VISIT_ENDED, fix.getTimestamp()));
            log.info("Visit ended for trip {}: movement resumed ({})", session.getTripId(), fix.getActivity());
        }
        session.resetDwell();
        return ended;
    }

    private static DwellEvent event(TrackingSession session, DwellEvent.Kind kind, Instant observedAt) {
        return new DwellEvent(
                session.getTripId(),
                kind,
                session.getDwellStage(),
                session.getDwellStartedAt(),
                observedAt,
                session.getDwellAnchor());
    }
}
