package fpt.com.patientrecordservices.domain.profile.dto;

import fpt.com.patientrecordservices.domain.clinicaldocument.entity.ClinicalDocument;
import fpt.com.patientrecordservices.domain.contactinfo.entity.ContactInfo;
import fpt.com.patientrecordservices.domain.medicalhistory.entity.MedicalHistory;
import fpt.com.patientrecordservices.domain.patient.entity.Patient;
import fpt.com.patientrecordservices.domain.visit.entity.Visit;
import fpt.com.patientrecordservices.domain.vitals.entity.Vitals;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything known about one patient. Missing contact info or vitals are serialized as null,
 * not as an empty object like on the single-resource endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientProfileDto {
    private Patient patient;
    private ContactInfo contactInfo;
    private List<ClinicalDocument> clinicalDocuments;
    private List<MedicalHistory> medicalHistory;
    private List<Visit> visits;
    private Vitals vitals;
}
