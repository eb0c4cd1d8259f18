package fpt.com.patientrecordservices.domain.vitals.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// recorded_at is not accepted from clients
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VitalsRequest {
    private Double temperature;
    private String bloodPressure;
    private Integer heartRate;
    private Double heightCm;
    private Double weightKg;
    private String notes;
}
