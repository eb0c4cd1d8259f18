package fpt.com.patientrecordservices.domain.patient.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientCreateRequest {
    private String fullName;
    private LocalDate birthDate;
    private String gender;
    private String nationalId;
    private String nationality;
    private String languageSpoken;
    private String bloodType;
}
