package com.atlas.journal.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.atlas.journal.dto.CurateTripRequest;
import com.atlas.journal.dto.CurationResult;
import com.atlas.journal.service.PhotoCurationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

/**
 * REST controller for photo curation runs.
 */
@RestController
@RequestMapping("/api/v1/trips")
@Validated
@Tag(name = "Photo Curation", description = "APIs for clustering and curating trip photos")
public class CurationController {

    private final PhotoCurationService curationService;

    @Autowired
    public CurationController(PhotoCurationService curationService) {
        this.curationService = curationService;
    }

    @PostMapping(
            value = "/{tripId}/curation",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Curate trip photos", description = "Filter, cluster and hand off the submitted photo analyses")
    public ResponseEntity<CurationResult> curate(
            @PathVariable String tripId, @Valid @RequestBody CurateTripRequest request) {
        return ResponseEntity.ok(curationService.curateTripPhotos(tripId, request.photos()));
    }
}
