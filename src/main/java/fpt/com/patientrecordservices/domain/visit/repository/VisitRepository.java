package fpt.com.patientrecordservices.domain.visit.repository;

import fpt.com.patientrecordservices.domain.visit.entity.Visit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VisitRepository extends JpaRepository<Visit, Long> {

    List<Visit> findByPatientIdOrderByVisitDateDescVisitIdDesc(Long patientId);
}
