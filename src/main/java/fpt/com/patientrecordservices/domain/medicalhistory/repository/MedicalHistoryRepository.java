package fpt.com.patientrecordservices.domain.medicalhistory.repository;

import fpt.com.patientrecordservices.domain.medicalhistory.entity.MedicalHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MedicalHistoryRepository extends JpaRepository<MedicalHistory, Long> {

    Optional<MedicalHistory> findFirstByPatientIdOrderByCreatedAtDescHistoryIdDesc(Long patientId);

    List<MedicalHistory> findByPatientIdOrderByCreatedAtDescHistoryIdDesc(Long patientId);
}
