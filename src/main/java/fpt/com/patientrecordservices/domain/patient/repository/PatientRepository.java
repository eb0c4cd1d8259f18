package fpt.com.patientrecordservices.domain.patient.repository;

import fpt.com.patientrecordservices.domain.patient.entity.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface PatientRepository extends JpaRepository<Patient, Long> {

    // Returns the number of rows touched; 0 when the patient does not exist
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Patient p SET p.profilePhotoPath = :path WHERE p.patientId = :patientId")
    int updateProfilePhotoPath(@Param("patientId") Long patientId, @Param("path") String path);
}
