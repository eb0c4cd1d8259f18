package fpt.com.patientrecordservices.domain.clinicaldocument.repository;

import fpt.com.patientrecordservices.common.config.JpaAuditingConfig;
import fpt.com.patientrecordservices.common.config.TimeConfig;
import fpt.com.patientrecordservices.domain.clinicaldocument.entity.ClinicalDocument;
import fpt.com.patientrecordservices.domain.contactinfo.entity.ContactInfo;
import fpt.com.patientrecordservices.domain.contactinfo.repository.ContactInfoRepository;
import fpt.com.patientrecordservices.domain.patient.entity.Patient;
import fpt.com.patientrecordservices.domain.patient.repository.PatientRepository;
import fpt.com.patientrecordservices.domain.visit.entity.Visit;
import fpt.com.patientrecordservices.domain.visit.repository.VisitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({JpaAuditingConfig.class, TimeConfig.class})
class ClinicalDocumentRepositoryTest {

    @Autowired
    private ClinicalDocumentRepository documentRepository;

    @Autowired
    private ContactInfoRepository contactInfoRepository;

    @Autowired
    private VisitRepository visitRepository;

    @Autowired
    private PatientRepository patientRepository;

    private Long patientId;

    @BeforeEach
    void setUp() {
        patientId = patientRepository.save(Patient.builder().fullName("Jane Doe").build()).getPatientId();
    }

    @Test
    void documents_shouldBeListedNewestUploadFirst() {
        documentRepository.save(ClinicalDocument.builder()
                .patientId(patientId)
                .documentName("blood panel")
                .uploadDate(LocalDateTime.of(2024, 2, 1, 10, 0))
                .fileType("application/pdf")
                .filePath("uploads/clinicaldocs/1.pdf")
                .build());
        documentRepository.save(ClinicalDocument.builder()
                .patientId(patientId)
                .documentName("x-ray")
                .uploadDate(LocalDateTime.of(2024, 2, 9, 10, 0))
                .fileType("image/png")
                .filePath("uploads/clinicaldocs/2.png")
                .build());

        assertThat(documentRepository.findByPatientIdOrderByUploadDateDescDocumentIdDesc(patientId))
                .extracting(ClinicalDocument::getDocumentName)
                .containsExactly("x-ray", "blood panel");
    }

    @Test
    void visits_shouldBeListedNewestVisitDateFirst() {
        visitRepository.save(Visit.builder().patientId(patientId).visitDate(LocalDate.of(2023, 6, 1)).reason("checkup").build());
        visitRepository.save(Visit.builder().patientId(patientId).visitDate(LocalDate.of(2024, 6, 1)).reason("flu").build());
        visitRepository.save(Visit.builder().patientId(patientId).visitDate(LocalDate.of(2022, 6, 1)).reason("injury").build());

        assertThat(visitRepository.findByPatientIdOrderByVisitDateDescVisitIdDesc(patientId))
                .extracting(Visit::getReason)
                .containsExactly("flu", "checkup", "injury");
    }

    @Test
    void contactInfo_shouldGetCreationTimestampFromAuditing() {
        ContactInfo saved = contactInfoRepository.save(ContactInfo.builder()
                .patientId(patientId)
                .phone("555-0100")
                .build());

        assertThat(saved.getCreatedAt()).isNotNull();
        assertThat(contactInfoRepository.findFirstByPatientIdOrderByCreatedAtDescContactIdDesc(patientId))
                .map(ContactInfo::getPhone)
                .contains("555-0100");
    }
}
