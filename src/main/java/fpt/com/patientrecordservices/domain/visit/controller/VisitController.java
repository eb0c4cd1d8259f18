package fpt.com.patientrecordservices.domain.visit.controller;

import fpt.com.patientrecordservices.domain.visit.dto.VisitRequest;
import fpt.com.patientrecordservices.domain.visit.entity.Visit;
import fpt.com.patientrecordservices.domain.visit.service.VisitService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping(value = "/patients/{id}/visits", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class VisitController {

    private final VisitService service;

    @GetMapping
    public ResponseEntity<List<Visit>> getAll(@PathVariable("id") Long id) {
        return ResponseEntity.ok(service.getAll(id));
    }

    @PutMapping
    public ResponseEntity<Visit> create(@PathVariable("id") Long id,
                                        @RequestBody(required = false) VisitRequest request) {
        return ResponseEntity.ok(service.create(id, request != null ? request : new VisitRequest()));
    }
}
