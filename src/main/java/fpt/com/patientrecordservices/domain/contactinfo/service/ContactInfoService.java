package fpt.com.patientrecordservices.domain.contactinfo.service;

import fpt.com.patientrecordservices.common.exception.StoreException;
import fpt.com.patientrecordservices.domain.contactinfo.dto.ContactInfoRequest;
import fpt.com.patientrecordservices.domain.contactinfo.entity.ContactInfo;
import fpt.com.patientrecordservices.domain.contactinfo.repository.ContactInfoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContactInfoService {

    private final ContactInfoRepository repository;

    public Optional<ContactInfo> getLatest(Long patientId) {
        try {
            return repository.findFirstByPatientIdOrderByCreatedAtDescContactIdDesc(patientId);
        } catch (DataAccessException e) {
            log.error("Error fetching contact info for patient {}", patientId, e);
            throw new StoreException("Failed to fetch contact info", e);
        }
    }

    // Always a new row; earlier contact details stay in the table
    public ContactInfo create(Long patientId, ContactInfoRequest request) {
        ContactInfo contactInfo = ContactInfo.builder()
                .patientId(patientId)
                .phone(request.getPhone())
                .email(request.getEmail())
                .address(request.getAddress())
                .emergencyName(request.getEmergencyName())
                .emergencyRelation(request.getEmergencyRelation())
                .emergencyPhone(request.getEmergencyPhone())
                .build();
        try {
            return repository.save(contactInfo);
        } catch (DataAccessException e) {
            log.error("Error saving contact info for patient {}", patientId, e);
            throw new StoreException("Failed to save contact info", e);
        }
    }
}
