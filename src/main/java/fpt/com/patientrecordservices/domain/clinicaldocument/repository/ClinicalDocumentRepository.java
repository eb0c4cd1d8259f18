package fpt.com.patientrecordservices.domain.clinicaldocument.repository;

import fpt.com.patientrecordservices.domain.clinicaldocument.entity.ClinicalDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ClinicalDocumentRepository extends JpaRepository<ClinicalDocument, Long> {

    List<ClinicalDocument> findByPatientIdOrderByUploadDateDescDocumentIdDesc(Long patientId);
}
