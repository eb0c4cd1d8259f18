package fpt.com.patientrecordservices.domain.medicalhistory.controller;

import fpt.com.patientrecordservices.domain.medicalhistory.dto.MedicalHistoryRequest;
import fpt.com.patientrecordservices.domain.medicalhistory.entity.MedicalHistory;
import fpt.com.patientrecordservices.domain.medicalhistory.service.MedicalHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping(value = "/patients/{id}/medical_history", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class MedicalHistoryController {

    private final MedicalHistoryService service;

    @GetMapping
    public ResponseEntity<?> getLatest(@PathVariable("id") Long id) {
        return service.getLatest(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of()));
    }

    @PutMapping
    public ResponseEntity<MedicalHistory> create(@PathVariable("id") Long id,
                                                 @RequestBody(required = false) MedicalHistoryRequest request) {
        return ResponseEntity.ok(service.create(id, request != null ? request : new MedicalHistoryRequest()));
    }
}
