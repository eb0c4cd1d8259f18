package fpt.com.patientrecordservices.domain.patient.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "patients")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Patient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "patient_id")
    private Long patientId;

    private String fullName;
    private LocalDate birthDate;
    private String gender;
    private String nationalId;
    private String nationality;
    private String languageSpoken;
    private String bloodType;

    // Set on intake or later through the photo endpoint
    private String profilePhotoPath;
}
