package fpt.com.patientrecordservices.domain.patient.controller;

import fpt.com.patientrecordservices.domain.patient.dto.PatientCreateRequest;
import fpt.com.patientrecordservices.domain.patient.entity.Patient;
import fpt.com.patientrecordservices.domain.patient.service.PatientService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping(value = "/patients", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class PatientController {

    private final PatientService patientService;

    // Intake form, optionally with a profile photo
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Patient> createPatient(
            @RequestParam(value = "full_name", required = false) String fullName,
            @RequestParam(value = "birth_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate birthDate,
            @RequestParam(value = "gender", required = false) String gender,
            @RequestParam(value = "national_id", required = false) String nationalId,
            @RequestParam(value = "nationality", required = false) String nationality,
            @RequestParam(value = "language_spoken", required = false) String languageSpoken,
            @RequestParam(value = "blood_type", required = false) String bloodType,
            @RequestParam(value = "profile_photo", required = false) MultipartFile profilePhoto) {
        PatientCreateRequest request = PatientCreateRequest.builder()
                .fullName(fullName)
                .birthDate(birthDate)
                .gender(gender)
                .nationalId(nationalId)
                .nationality(nationality)
                .languageSpoken(languageSpoken)
                .bloodType(bloodType)
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(patientService.createPatient(request, profilePhoto));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Patient> createPatientFromJson(@RequestBody PatientCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(patientService.createPatient(request, null));
    }

    @PostMapping(value = "/{id}/photo", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> uploadProfilePhoto(
            @PathVariable("id") Long id,
            @RequestParam(value = "photo", required = false) MultipartFile photo) {
        String path = patientService.updateProfilePhoto(id, photo);
        return ResponseEntity.ok(Map.of("success", true, "profile_photo_path", path));
    }

    @GetMapping
    public ResponseEntity<List<Patient>> getAllPatients() {
        return ResponseEntity.ok(patientService.getAllPatients());
    }

    // Unknown id answers {} rather than 404
    @GetMapping("/{id}")
    public ResponseEntity<?> getPatient(@PathVariable("id") Long id) {
        return patientService.findPatient(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of()));
    }
}
