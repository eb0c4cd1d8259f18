package fpt.com.patientrecordservices.domain.contactinfo.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactInfoRequest {
    private String phone;
    private String email;
    private String address;
    private String emergencyName;
    private String emergencyRelation;
    private String emergencyPhone;
}
