package fpt.com.patientrecordservices.domain.visit.service;

import fpt.com.patientrecordservices.common.exception.StoreException;
import fpt.com.patientrecordservices.domain.visit.dto.VisitRequest;
import fpt.com.patientrecordservices.domain.visit.entity.Visit;
import fpt.com.patientrecordservices.domain.visit.repository.VisitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class VisitService {

    private final VisitRepository repository;

    public List<Visit> getAll(Long patientId) {
        try {
            return repository.findByPatientIdOrderByVisitDateDescVisitIdDesc(patientId);
        } catch (DataAccessException e) {
            log.error("Error fetching visits for patient {}", patientId, e);
            throw new StoreException("Failed to fetch visits", e);
        }
    }

    public Visit create(Long patientId, VisitRequest request) {
        Visit visit = Visit.builder()
                .patientId(patientId)
                .visitDate(request.getVisitDate())
                .doctorName(request.getDoctorName())
                .reason(request.getReason())
                .diagnosis(request.getDiagnosis())
                .treatment(request.getTreatment())
                .build();
        try {
            return repository.save(visit);
        } catch (DataAccessException e) {
            log.error("Error inserting visit history for patient {}", patientId, e);
            throw new StoreException("Failed to insert visit history", e);
        }
    }
}
