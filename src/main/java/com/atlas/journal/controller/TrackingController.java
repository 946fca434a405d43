package com.atlas.journal.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.atlas.journal.client.DeviceLocationCapability;
import com.atlas.journal.client.LocationCapability;
import com.atlas.journal.dto.RawLocationSample;
import com.atlas.journal.dto.StopResult;
import com.atlas.journal.dto.TrackingStatus;
import com.atlas.journal.exception.DeviceReportingUnavailableException;
import com.atlas.journal.service.AdaptiveSampler;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

/**
 * REST controller for the tracking lifecycle and device reports.
 *
 * <p>Errors are raised as exceptions and mapped to HTTP statuses by {@link GlobalExceptionHandler}.
 * Device reports are only accepted while the active location capability is the REST-fed
 * {@link DeviceLocationCapability}; with another capability plugged in they answer 501.
 */
@RestController
@RequestMapping("/api/v1/tracking")
@Validated
@Tag(name = "Location Tracking", description = "APIs for adaptive trip location tracking")
public class TrackingController {

    private final AdaptiveSampler adaptiveSampler;
    private final LocationCapability locationCapability;

    @Autowired
    public TrackingController(AdaptiveSampler adaptiveSampler, LocationCapability locationCapability) {
        this.adaptiveSampler = adaptiveSampler;
        this.locationCapability = locationCapability;
    }

    @PostMapping(value = "/start", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Start tracking", description = "Start a tracking session for a trip")
    public ResponseEntity<TrackingStatus> start(@RequestParam @NotBlank String tripId) {
        return ResponseEntity.ok(adaptiveSampler.start(tripId));
    }

    @PostMapping(value = "/pause", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Pause tracking", description = "Suspend sampling, keeping the session")
    public ResponseEntity<TrackingStatus> pause() {
        return ResponseEntity.ok(adaptiveSampler.pause());
    }

    @PostMapping(value = "/resume", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Resume tracking", description = "Resume sampling with an immediate capture")
    public ResponseEntity<TrackingStatus> resume() {
        return ResponseEntity.ok(adaptiveSampler.resume());
    }

    @PostMapping(value = "/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Stop tracking", description = "Stop the session and flush pending fixes")
    public ResponseEntity<StopResult> stop() {
        return ResponseEntity.ok(adaptiveSampler.stop());
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Tracking status", description = "Current tracking session snapshot")
    public ResponseEntity<TrackingStatus> status() {
        return ResponseEntity.ok(adaptiveSampler.getStatus());
    }

    @PostMapping(value = "/fixes", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Report location", description = "Device reports its latest position for the next tick")
    public ResponseEntity<Void> reportFix(@Valid @RequestBody RawLocationSample sample) {
        requireDeviceLocation().report(sample);
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @PutMapping("/permission")
    @Operation(summary = "Report permission", description = "Device reports its location permission state")
    public ResponseEntity<Void> reportPermission(@RequestParam boolean granted) {
        requireDeviceLocation().setPermission(granted);
        return ResponseEntity.noContent().build();
    }

    private DeviceLocationCapability requireDeviceLocation() {
        if (!(locationCapability instanceof DeviceLocationCapability)) {
            throw new DeviceReportingUnavailableException(
                    "Location is read from " + locationCapability.getClass().getSimpleName()
                            + ", which does not accept REST reports");
        }
        return (DeviceLocationCapability) locationCapability;
    }
}
