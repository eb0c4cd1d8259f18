package fpt.com.patientrecordservices.domain.visit.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitRequest {
    private LocalDate visitDate;
    private String doctorName;
    private String reason;
    private String diagnosis;
    private String treatment;
}
