package com.atlas.journal.client;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.atlas.journal.dto.RawLocationSample;
import com.atlas.journal.dto.SamplingProfile;

import lombok.extern.slf4j.Slf4j;

/**
 * Location capability fed by the device over the REST surface.
 *
 * <p>The device reports its latest position and its permission state; each tick consumes the
 * latest report at most once, so a device that stops reporting produces empty ticks rather than
 * repeated copies of a stale position. Permission is denied until the device says otherwise.
 */
@Slf4j
public class DeviceLocationCapability implements LocationCapability {

    private final AtomicReference<RawLocationSample> latest = new AtomicReference<>();
    private final AtomicBoolean permissionGranted = new AtomicBoolean(false);
    private final AtomicReference<SamplingProfile> currentProfile = new AtomicReference<>();

    public void report(RawLocationSample sample) {
        RawLocationSample previous = latest.getAndSet(sample);
        if (previous != null) {
            log.debug("Replacing unconsumed device report from {}", previous.timestamp());
        }
    }

    public void setPermission(boolean granted) {
        boolean previous = permissionGranted.getAndSet(granted);
        if (previous != granted) {
            log.info("Device location permission changed: granted={}", granted);
        }
    }

    @Override
    public Optional<RawLocationSample> getCurrentFix() {
        return Optional.ofNullable(latest.getAndSet(null));
    }

    @Override
    public boolean hasPermission() {
        return permissionGranted.get();
    }

    @Override
    public void applyProfile(SamplingProfile profile) {
        currentProfile.set(profile);
        log.debug("Sampling profile for device: interval={}ms, distanceFilter={}m, batterySaver={}",
                profile.intervalMs(), profile.distanceFilterM(), profile.batterySaver());
    }

    /**
     * The profile the device should currently sample with, or empty before tracking starts.
     */
    public Optional<SamplingProfile> getCurrentProfile() {
        return Optional.ofNullable(currentProfile.get());
    }
}
