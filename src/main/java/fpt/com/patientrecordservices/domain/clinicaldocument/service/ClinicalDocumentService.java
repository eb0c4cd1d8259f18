package fpt.com.patientrecordservices.domain.clinicaldocument.service;

import fpt.com.patientrecordservices.common.constants.Constants;
import fpt.com.patientrecordservices.common.exception.BadRequestException;
import fpt.com.patientrecordservices.common.exception.StoreException;
import fpt.com.patientrecordservices.common.storage.FileStorageService;
import fpt.com.patientrecordservices.domain.clinicaldocument.entity.ClinicalDocument;
import fpt.com.patientrecordservices.domain.clinicaldocument.repository.ClinicalDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClinicalDocumentService {

    private final ClinicalDocumentRepository repository;
    private final FileStorageService fileStorageService;
    private final Clock clock;

    public List<ClinicalDocument> getAll(Long patientId) {
        try {
            return repository.findByPatientIdOrderByUploadDateDescDocumentIdDesc(patientId);
        } catch (DataAccessException e) {
            log.error("Error fetching clinical_documents for patient {}", patientId, e);
            throw new StoreException("Failed to fetch clinical_documents", e);
        }
    }

    /**
     * Stores the file, then inserts the row pointing at it. Any file type is accepted.
     */
    public ClinicalDocument upload(Long patientId, String documentName, MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException(Constants.MSG_NO_FILE_UPLOADED);
        }
        String filePath = fileStorageService.storeClinicalDocument(file);

        ClinicalDocument document = ClinicalDocument.builder()
                .patientId(patientId)
                .documentName(documentName)
                .uploadDate(LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS))
                .fileType(file.getContentType())
                .filePath(filePath)
                .build();
        try {
            return repository.save(document);
        } catch (DataAccessException e) {
            log.error("Database error inserting clinical document for patient {}", patientId, e);
            fileStorageService.reportOrphan(filePath);
            throw new StoreException("Database error inserting document", e);
        }
    }
}
