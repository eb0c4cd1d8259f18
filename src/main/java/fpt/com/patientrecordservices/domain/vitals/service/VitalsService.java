package fpt.com.patientrecordservices.domain.vitals.service;

import fpt.com.patientrecordservices.common.exception.StoreException;
import fpt.com.patientrecordservices.domain.vitals.dto.VitalsRequest;
import fpt.com.patientrecordservices.domain.vitals.entity.Vitals;
import fpt.com.patientrecordservices.domain.vitals.repository.VitalsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class VitalsService {

    private final VitalsRepository repository;
    private final Clock clock;

    public Optional<Vitals> getLatest(Long patientId) {
        try {
            return repository.findFirstByPatientIdOrderByRecordedAtDescVitalsIdDesc(patientId);
        } catch (DataAccessException e) {
            log.error("Error fetching vitals for patient {}", patientId, e);
            throw new StoreException("Failed to fetch vitals", e);
        }
    }

    // Newest first
    public List<Vitals> getHistory(Long patientId) {
        try {
            return repository.findByPatientIdOrderByRecordedAtDescVitalsIdDesc(patientId);
        } catch (DataAccessException e) {
            log.error("Error fetching vitals history for patient {}", patientId, e);
            throw new StoreException("Failed to fetch vitals", e);
        }
    }

    public Vitals record(Long patientId, VitalsRequest request) {
        Vitals vitals = Vitals.builder()
                .patientId(patientId)
                .temperature(request.getTemperature())
                .bloodPressure(request.getBloodPressure())
                .heartRate(request.getHeartRate())
                .heightCm(request.getHeightCm())
                .weightKg(request.getWeightKg())
                .notes(request.getNotes())
                .recordedAt(LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS))
                .build();
        try {
            return repository.save(vitals);
        } catch (DataAccessException e) {
            log.error("Error saving vitals for patient {}", patientId, e);
            throw new StoreException("Failed to save vitals", e);
        }
    }
}
