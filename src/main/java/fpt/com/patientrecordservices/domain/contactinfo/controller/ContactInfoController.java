package fpt.com.patientrecordservices.domain.contactinfo.controller;

import fpt.com.patientrecordservices.domain.contactinfo.dto.ContactInfoRequest;
import fpt.com.patientrecordservices.domain.contactinfo.entity.ContactInfo;
import fpt.com.patientrecordservices.domain.contactinfo.service.ContactInfoService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping(value = "/patients/{id}/contact_info", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class ContactInfoController {

    private final ContactInfoService service;

    @GetMapping
    public ResponseEntity<?> getLatest(@PathVariable("id") Long id) {
        return service.getLatest(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of()));
    }

    @PutMapping
    public ResponseEntity<ContactInfo> create(@PathVariable("id") Long id,
                                              @RequestBody(required = false) ContactInfoRequest request) {
        return ResponseEntity.ok(service.create(id, request != null ? request : new ContactInfoRequest()));
    }
}
