package fpt.com.patientrecordservices.domain.medicalhistory.service;

import fpt.com.patientrecordservices.common.exception.StoreException;
import fpt.com.patientrecordservices.domain.medicalhistory.dto.MedicalHistoryRequest;
import fpt.com.patientrecordservices.domain.medicalhistory.entity.MedicalHistory;
import fpt.com.patientrecordservices.domain.medicalhistory.repository.MedicalHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class MedicalHistoryService {

    private final MedicalHistoryRepository repository;

    public Optional<MedicalHistory> getLatest(Long patientId) {
        try {
            return repository.findFirstByPatientIdOrderByCreatedAtDescHistoryIdDesc(patientId);
        } catch (DataAccessException e) {
            log.error("Error fetching medical_history for patient {}", patientId, e);
            throw new StoreException("Failed to fetch medical_history", e);
        }
    }

    public List<MedicalHistory> getAll(Long patientId) {
        try {
            return repository.findByPatientIdOrderByCreatedAtDescHistoryIdDesc(patientId);
        } catch (DataAccessException e) {
            log.error("Error fetching medical_history list for patient {}", patientId, e);
            throw new StoreException("Failed to fetch medical_history", e);
        }
    }

    public MedicalHistory create(Long patientId, MedicalHistoryRequest request) {
        MedicalHistory history = MedicalHistory.builder()
                .patientId(patientId)
                .allergies(request.getAllergies())
                .currentMedications(request.getCurrentMedications())
                .pastMedicalHistory(request.getPastMedicalHistory())
                .surgicalHistory(request.getSurgicalHistory())
                .familyHistory(request.getFamilyHistory())
                .immunizationRecords(request.getImmunizationRecords())
                .chronicConditions(request.getChronicConditions())
                .mentalHealthConditions(request.getMentalHealthConditions())
                .build();
        try {
            return repository.save(history);
        } catch (DataAccessException e) {
            log.error("Error inserting medical history for patient {}", patientId, e);
            throw new StoreException("Failed to insert medical history", e);
        }
    }
}
