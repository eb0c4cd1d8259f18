package fpt.com.patientrecordservices.domain.profile.controller;

import fpt.com.patientrecordservices.domain.profile.dto.PatientProfileDto;
import fpt.com.patientrecordservices.domain.profile.service.PatientProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = "/patients/{id}/full", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class PatientProfileController {

    private final PatientProfileService service;

    // 404 when the patient does not exist, unlike GET /patients/{id}
    @GetMapping
    public ResponseEntity<PatientProfileDto> getFullProfile(@PathVariable("id") Long id) {
        return ResponseEntity.ok(service.getFullProfile(id));
    }
}
