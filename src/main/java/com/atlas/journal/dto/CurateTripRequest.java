package com.atlas.journal.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/** Scored photo metadata submitted for curation. */
public record CurateTripRequest(
    @NotNull(message = "Photos are required") List<@Valid PhotoAnalysis> photos) {}
