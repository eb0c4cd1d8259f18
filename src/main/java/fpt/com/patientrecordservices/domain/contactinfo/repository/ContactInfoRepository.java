package fpt.com.patientrecordservices.domain.contactinfo.repository;

import fpt.com.patientrecordservices.domain.contactinfo.entity.ContactInfo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ContactInfoRepository extends JpaRepository<ContactInfo, Long> {

    // Newest created_at, ties go to the highest id
    Optional<ContactInfo> findFirstByPatientIdOrderByCreatedAtDescContactIdDesc(Long patientId);
}
