package fpt.com.patientrecordservices.domain.vitals.repository;

import fpt.com.patientrecordservices.domain.vitals.entity.Vitals;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Both queries share one ordering, so the latest row is always the head of the history.
 */
@Repository
public interface VitalsRepository extends JpaRepository<Vitals, Long> {

    Optional<Vitals> findFirstByPatientIdOrderByRecordedAtDescVitalsIdDesc(Long patientId);

    List<Vitals> findByPatientIdOrderByRecordedAtDescVitalsIdDesc(Long patientId);
}
