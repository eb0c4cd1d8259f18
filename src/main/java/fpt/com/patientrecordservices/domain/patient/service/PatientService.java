package fpt.com.patientrecordservices.domain.patient.service;

import fpt.com.patientrecordservices.common.constants.Constants;
import fpt.com.patientrecordservices.common.exception.BadRequestException;
import fpt.com.patientrecordservices.common.exception.StoreException;
import fpt.com.patientrecordservices.common.storage.FileStorageService;
import fpt.com.patientrecordservices.domain.patient.dto.PatientCreateRequest;
import fpt.com.patientrecordservices.domain.patient.entity.Patient;
import fpt.com.patientrecordservices.domain.patient.repository.PatientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PatientService {

    private final PatientRepository patientRepository;
    private final FileStorageService fileStorageService;

    /**
     * Intake. The photo, if any, is written to disk before the row is inserted.
     */
    public Patient createPatient(PatientCreateRequest request, MultipartFile profilePhoto) {
        String photoPath = null;
        if (profilePhoto != null && !profilePhoto.isEmpty()) {
            photoPath = fileStorageService.storeProfilePhoto(Constants.NEW_PATIENT_KEY, profilePhoto);
        }

        Patient patient = Patient.builder()
                .fullName(request.getFullName())
                .birthDate(request.getBirthDate())
                .gender(request.getGender())
                .nationalId(request.getNationalId())
                .nationality(request.getNationality())
                .languageSpoken(request.getLanguageSpoken())
                .bloodType(request.getBloodType())
                .profilePhotoPath(photoPath)
                .build();

        try {
            Patient saved = patientRepository.save(patient);
            log.info("Created patient {}", saved.getPatientId());
            return saved;
        } catch (DataAccessException e) {
            log.error("Error inserting patient", e);
            if (photoPath != null) {
                fileStorageService.reportOrphan(photoPath);
            }
            throw new StoreException("Failed to add patient", e);
        }
    }

    /**
     * Replaces the profile photo path. An unknown id still stores the file and reports success.
     *
     * @return the new relative photo path
     */
    public String updateProfilePhoto(Long patientId, MultipartFile photo) {
        if (photo == null || photo.isEmpty()) {
            throw new BadRequestException(Constants.MSG_NO_FILE_UPLOADED);
        }
        String photoPath = fileStorageService.storeProfilePhoto(String.valueOf(patientId), photo);

        try {
            int updated = patientRepository.updateProfilePhotoPath(patientId, photoPath);
            if (updated == 0) {
                log.warn("Profile photo stored for unknown patient {}", patientId);
            }
            return photoPath;
        } catch (DataAccessException e) {
            log.error("Error updating DB with profile photo path for patient {}", patientId, e);
            fileStorageService.reportOrphan(photoPath);
            throw new StoreException("Failed to update profile photo", e);
        }
    }

    public List<Patient> getAllPatients() {
        try {
            return patientRepository.findAll(Sort.by("patientId"));
        } catch (DataAccessException e) {
            log.error("Error fetching patients", e);
            throw new StoreException(Constants.MSG_INTERNAL_ERROR, e);
        }
    }

    public Optional<Patient> findPatient(Long patientId) {
        try {
            return patientRepository.findById(patientId);
        } catch (DataAccessException e) {
            log.error("Error fetching patient {}", patientId, e);
            throw new StoreException("Failed to fetch patient info", e);
        }
    }
}
