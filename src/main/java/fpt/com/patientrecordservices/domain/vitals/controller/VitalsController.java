package fpt.com.patientrecordservices.domain.vitals.controller;

import fpt.com.patientrecordservices.domain.vitals.dto.VitalsRequest;
import fpt.com.patientrecordservices.domain.vitals.entity.Vitals;
import fpt.com.patientrecordservices.domain.vitals.service.VitalsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping(value = "/patients/{id}/vitals", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class VitalsController {

    private final VitalsService service;

    @GetMapping
    public ResponseEntity<?> getLatest(@PathVariable("id") Long id) {
        return service.getLatest(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of()));
    }

    // PUT appends a snapshot; previous readings are kept
    @PutMapping
    public ResponseEntity<Vitals> record(@PathVariable("id") Long id,
                                         @RequestBody(required = false) VitalsRequest request) {
        return ResponseEntity.ok(service.record(id, request != null ? request : new VitalsRequest()));
    }
}
