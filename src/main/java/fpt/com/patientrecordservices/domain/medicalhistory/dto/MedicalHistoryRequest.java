package fpt.com.patientrecordservices.domain.medicalhistory.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MedicalHistoryRequest {
    private String allergies;
    private String currentMedications;
    private String pastMedicalHistory;
    private String surgicalHistory;
    private String familyHistory;
    private String immunizationRecords;
    private String chronicConditions;
    private String mentalHealthConditions;
}
