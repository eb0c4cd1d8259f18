package fpt.com.patientrecordservices.domain.profile.service;

import fpt.com.patientrecordservices.common.config.ProfileProperties;
import fpt.com.patientrecordservices.common.constants.Constants;
import fpt.com.patientrecordservices.common.exception.NotFoundException;
import fpt.com.patientrecordservices.common.exception.StoreException;
import fpt.com.patientrecordservices.domain.clinicaldocument.service.ClinicalDocumentService;
import fpt.com.patientrecordservices.domain.contactinfo.entity.ContactInfo;
import fpt.com.patientrecordservices.domain.contactinfo.service.ContactInfoService;
import fpt.com.patientrecordservices.domain.medicalhistory.service.MedicalHistoryService;
import fpt.com.patientrecordservices.domain.patient.entity.Patient;
import fpt.com.patientrecordservices.domain.patient.service.PatientService;
import fpt.com.patientrecordservices.domain.profile.dto.PatientProfileDto;
import fpt.com.patientrecordservices.domain.visit.service.VisitService;
import fpt.com.patientrecordservices.domain.vitals.entity.Vitals;
import fpt.com.patientrecordservices.domain.vitals.service.VitalsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds the full profile of a patient: existence check first, then the five sub-record
 * reads in parallel. One failed read fails the whole profile.
 */
@Slf4j
@Service
public class PatientProfileService {

    private final PatientService patientService;
    private final ContactInfoService contactInfoService;
    private final ClinicalDocumentService clinicalDocumentService;
    private final MedicalHistoryService medicalHistoryService;
    private final VisitService visitService;
    private final VitalsService vitalsService;
    private final Executor executor;
    private final Duration queryTimeout;

    public PatientProfileService(PatientService patientService,
                                 ContactInfoService contactInfoService,
                                 ClinicalDocumentService clinicalDocumentService,
                                 MedicalHistoryService medicalHistoryService,
                                 VisitService visitService,
                                 VitalsService vitalsService,
                                 @Qualifier("profileQueryExecutor") Executor executor,
                                 ProfileProperties properties) {
        this.patientService = patientService;
        this.contactInfoService = contactInfoService;
        this.clinicalDocumentService = clinicalDocumentService;
        this.medicalHistoryService = medicalHistoryService;
        this.visitService = visitService;
        this.vitalsService = vitalsService;
        this.executor = executor;
        this.queryTimeout = properties.getQueryTimeout();
    }

    /**
     * @throws NotFoundException if the patient does not exist; no other query is issued then
     * @throws StoreException if any sub-record read fails or the reads exceed the configured timeout
     */
    public PatientProfileDto getFullProfile(Long patientId) {
        Patient patient = patientService.findPatient(patientId)
                .orElseThrow(() -> new NotFoundException(Constants.MSG_PATIENT_NOT_FOUND,
                        Map.of("patientId", patientId)));

        CompletionService<Object> completion = new ExecutorCompletionService<>(executor);
        Future<Object> contactInfo = completion.submit(() -> contactInfoService.getLatest(patientId));
        Future<Object> documents = completion.submit(() -> clinicalDocumentService.getAll(patientId));
        Future<Object> medicalHistory = completion.submit(() -> medicalHistoryService.getAll(patientId));
        Future<Object> visits = completion.submit(() -> visitService.getAll(patientId));
        Future<Object> vitals = completion.submit(() -> vitalsService.getHistory(patientId));

        List<Future<Object>> reads = List.of(contactInfo, documents, medicalHistory, visits, vitals);
        awaitAll(patientId, completion, reads);

        Optional<ContactInfo> latestContact = resultOf(contactInfo);
        List<Vitals> vitalsHistory = resultOf(vitals);
        return PatientProfileDto.builder()
                .patient(patient)
                .contactInfo(latestContact.orElse(null))
                .clinicalDocuments(resultOf(documents))
                .medicalHistory(resultOf(medicalHistory))
                .visits(resultOf(visits))
                .vitals(vitalsHistory.isEmpty() ? null : vitalsHistory.get(0))
                .build();
    }

    // Reads are taken in completion order against a single deadline
    private void awaitAll(Long patientId, CompletionService<Object> completion, List<Future<Object>> reads) {
        long deadline = System.nanoTime() + queryTimeout.toNanos();
        try {
            for (int i = 0; i < reads.size(); i++) {
                Future<Object> done = completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (done == null) {
                    cancel(reads);
                    log.error("Full patient profile for patient {} not ready after {}", patientId, queryTimeout);
                    throw new StoreException(Constants.MSG_INTERNAL_ERROR,
                            new TimeoutException("profile reads exceeded " + queryTimeout));
                }
                done.get();
            }
        } catch (ExecutionException e) {
            cancel(reads);
            log.error("Error fetching full patient profile for patient {}", patientId, e.getCause());
            throw new StoreException(Constants.MSG_INTERNAL_ERROR, e.getCause());
        } catch (InterruptedException e) {
            cancel(reads);
            Thread.currentThread().interrupt();
            throw new StoreException(Constants.MSG_INTERNAL_ERROR, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T resultOf(Future<Object> read) {
        try {
            return (T) read.get();
        } catch (ExecutionException | InterruptedException e) {
            throw new IllegalStateException("Profile read was not completed", e);
        }
    }

    // Interrupts reads that are still running
    private static void cancel(List<Future<Object>> reads) {
        for (Future<Object> read : reads) {
            read.cancel(true);
        }
    }
}
