package fpt.com.patientrecordservices.domain.clinicaldocument.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import fpt.com.patientrecordservices.domain.patient.entity.Patient;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Metadata of an uploaded document. The file itself lives under the clinical documents directory.
 */
@Entity
@Table(name = "clinical_documents")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClinicalDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "document_id")
    private Long documentId;

    @Column(name = "patient_id", nullable = false)
    private Long patientId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", insertable = false, updatable = false)
    @JsonIgnore
    private Patient patient;

    private String documentName;

    @Column(name = "upload_date", nullable = false)
    private LocalDateTime uploadDate;

    // MIME type as declared by the client
    private String fileType;

    @Column(nullable = false)
    private String filePath;
}
