package fpt.com.patientrecordservices.domain.clinicaldocument.controller;

import fpt.com.patientrecordservices.domain.clinicaldocument.entity.ClinicalDocument;
import fpt.com.patientrecordservices.domain.clinicaldocument.service.ClinicalDocumentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping(value = "/patients/{id}/clinical_documents", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class ClinicalDocumentController {

    private final ClinicalDocumentService service;

    @GetMapping
    public ResponseEntity<List<ClinicalDocument>> getAll(@PathVariable("id") Long id) {
        return ResponseEntity.ok(service.getAll(id));
    }

    @PostMapping
    public ResponseEntity<ClinicalDocument> upload(
            @PathVariable("id") Long id,
            @RequestParam(value = "document_name", required = false) String documentName,
            @RequestParam(value = "file", required = false) MultipartFile file) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.upload(id, documentName, file));
    }
}
