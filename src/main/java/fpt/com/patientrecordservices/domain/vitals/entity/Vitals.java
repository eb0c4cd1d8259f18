package fpt.com.patientrecordservices.domain.vitals.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import fpt.com.patientrecordservices.domain.patient.entity.Patient;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A point-in-time measurement. Values are stored as given, without range checks.
 */
@Entity
@Table(name = "vitals")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vitals {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "vitals_id")
    private Long vitalsId;

    @Column(name = "patient_id", nullable = false)
    private Long patientId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", insertable = false, updatable = false)
    @JsonIgnore
    private Patient patient;

    private Double temperature;

    private String bloodPressure;
    private Integer heartRate;

    private Double heightCm;
    private Double weightKg;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;
}
