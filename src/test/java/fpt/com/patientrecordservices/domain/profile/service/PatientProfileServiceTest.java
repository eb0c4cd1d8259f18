package fpt.com.patientrecordservices.domain.profile.service;

import fpt.com.patientrecordservices.common.config.ProfileProperties;
import fpt.com.patientrecordservices.common.exception.NotFoundException;
import fpt.com.patientrecordservices.common.exception.StoreException;
import fpt.com.patientrecordservices.domain.clinicaldocument.entity.ClinicalDocument;
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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PatientProfileServiceTest {

    @Mock
    private PatientService patientService;
    @Mock
    private ContactInfoService contactInfoService;
    @Mock
    private ClinicalDocumentService clinicalDocumentService;
    @Mock
    private MedicalHistoryService medicalHistoryService;
    @Mock
    private VisitService visitService;
    @Mock
    private VitalsService vitalsService;

    private ExecutorService executor;
    private PatientProfileService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(5);
        ProfileProperties properties = new ProfileProperties();
        properties.setQueryTimeout(Duration.ofSeconds(5));
        service = newService(properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PatientProfileService newService(ProfileProperties properties) {
        return new PatientProfileService(patientService, contactInfoService, clinicalDocumentService,
                medicalHistoryService, visitService, vitalsService, executor, properties);
    }

    @Test
    void getFullProfile_unknownPatient_shouldThrowNotFoundWithoutSubQueries() {
        when(patientService.findPatient(99L)).thenReturn(Optional.empty());

        NotFoundException ex = assertThrows(NotFoundException.class, () -> service.getFullProfile(99L));

        assertEquals("Patient not found", ex.getCode());
        verifyNoInteractions(contactInfoService, clinicalDocumentService, medicalHistoryService,
                visitService, vitalsService);
    }

    @Test
    void getFullProfile_patientWithoutRecords_shouldUseNullsAndEmptyLists() {
        Patient patient = Patient.builder().patientId(1L).fullName("Jane Doe").build();
        when(patientService.findPatient(1L)).thenReturn(Optional.of(patient));
        when(contactInfoService.getLatest(1L)).thenReturn(Optional.empty());
        when(clinicalDocumentService.getAll(1L)).thenReturn(List.of());
        when(medicalHistoryService.getAll(1L)).thenReturn(List.of());
        when(visitService.getAll(1L)).thenReturn(List.of());
        when(vitalsService.getHistory(1L)).thenReturn(List.of());

        PatientProfileDto profile = service.getFullProfile(1L);

        assertSame(patient, profile.getPatient());
        assertNull(profile.getContactInfo());
        assertNull(profile.getVitals());
        assertTrue(profile.getClinicalDocuments().isEmpty());
        assertTrue(profile.getMedicalHistory().isEmpty());
        assertTrue(profile.getVisits().isEmpty());
    }

    @Test
    void getFullProfile_shouldTakeHeadOfVitalsHistory() {
        Vitals newest = Vitals.builder().vitalsId(3L).recordedAt(LocalDateTime.of(2024, 3, 3, 9, 0)).build();
        Vitals older = Vitals.builder().vitalsId(2L).recordedAt(LocalDateTime.of(2024, 3, 2, 9, 0)).build();
        ContactInfo contact = ContactInfo.builder().contactId(5L).phone("555-0100").build();
        ClinicalDocument doc = ClinicalDocument.builder().documentId(8L).documentName("x-ray").build();

        when(patientService.findPatient(1L)).thenReturn(Optional.of(Patient.builder().patientId(1L).build()));
        when(contactInfoService.getLatest(1L)).thenReturn(Optional.of(contact));
        when(clinicalDocumentService.getAll(1L)).thenReturn(List.of(doc));
        when(medicalHistoryService.getAll(1L)).thenReturn(List.of());
        when(visitService.getAll(1L)).thenReturn(List.of());
        when(vitalsService.getHistory(1L)).thenReturn(List.of(newest, older));

        PatientProfileDto profile = service.getFullProfile(1L);

        assertSame(newest, profile.getVitals());
        assertSame(contact, profile.getContactInfo());
        assertEquals(List.of(doc), profile.getClinicalDocuments());
    }

    @Test
    void getFullProfile_oneFailingRead_shouldFailWholeProfile() {
        when(patientService.findPatient(1L)).thenReturn(Optional.of(Patient.builder().patientId(1L).build()));
        when(contactInfoService.getLatest(1L)).thenReturn(Optional.empty());
        when(clinicalDocumentService.getAll(1L)).thenReturn(List.of());
        when(medicalHistoryService.getAll(1L)).thenReturn(List.of());
        when(visitService.getAll(1L)).thenThrow(new StoreException("Failed to fetch visits",
                new DataAccessResourceFailureException("connection reset")));
        when(vitalsService.getHistory(1L)).thenReturn(List.of());

        StoreException ex = assertThrows(StoreException.class, () -> service.getFullProfile(1L));

        assertEquals("Internal Server Error", ex.getCode());
        assertEquals("Failed to fetch visits", ((StoreException) ex.getCause()).getCode());
    }

    @Test
    void getFullProfile_shouldRunReadsConcurrently() {
        // Every read waits until all five have started; a sequential fan-out would time out
        CountDownLatch started = new CountDownLatch(5);
        when(patientService.findPatient(1L)).thenReturn(Optional.of(Patient.builder().patientId(1L).build()));
        when(contactInfoService.getLatest(1L)).thenAnswer(inv -> { rendezvous(started); return Optional.empty(); });
        when(clinicalDocumentService.getAll(1L)).thenAnswer(inv -> { rendezvous(started); return List.of(); });
        when(medicalHistoryService.getAll(1L)).thenAnswer(inv -> { rendezvous(started); return List.of(); });
        when(visitService.getAll(1L)).thenAnswer(inv -> { rendezvous(started); return List.of(); });
        when(vitalsService.getHistory(1L)).thenAnswer(inv -> { rendezvous(started); return List.of(); });

        PatientProfileDto profile = service.getFullProfile(1L);

        assertNotNull(profile.getPatient());
        assertEquals(0, started.getCount());
    }

    @Test
    void getFullProfile_slowRead_shouldFailAfterTimeoutAndInterruptTheRead() throws Exception {
        ProfileProperties properties = new ProfileProperties();
        properties.setQueryTimeout(Duration.ofMillis(100));
        PatientProfileService impatient = newService(properties);
        CountDownLatch released = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();

        when(patientService.findPatient(1L)).thenReturn(Optional.of(Patient.builder().patientId(1L).build()));
        when(contactInfoService.getLatest(1L)).thenReturn(Optional.empty());
        when(clinicalDocumentService.getAll(1L)).thenReturn(List.of());
        when(medicalHistoryService.getAll(1L)).thenReturn(List.of());
        when(visitService.getAll(1L)).thenReturn(List.of());
        when(vitalsService.getHistory(1L)).thenAnswer(inv -> hangUntilInterrupted(interrupted, released));

        StoreException ex = assertThrows(StoreException.class, () -> impatient.getFullProfile(1L));

        assertEquals("Internal Server Error", ex.getCode());
        assertTrue(ex.getCause() instanceof TimeoutException);
        assertTrue(released.await(1, TimeUnit.SECONDS), "slow read still holds its thread");
        assertTrue(interrupted.get());
    }

    @Test
    void getFullProfile_failingRead_shouldInterruptSiblingReads() throws Exception {
        CountDownLatch vitalsStarted = new CountDownLatch(1);
        CountDownLatch released = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();

        when(patientService.findPatient(1L)).thenReturn(Optional.of(Patient.builder().patientId(1L).build()));
        when(contactInfoService.getLatest(1L)).thenReturn(Optional.empty());
        when(clinicalDocumentService.getAll(1L)).thenReturn(List.of());
        when(medicalHistoryService.getAll(1L)).thenReturn(List.of());
        when(vitalsService.getHistory(1L)).thenAnswer(inv -> {
            vitalsStarted.countDown();
            return hangUntilInterrupted(interrupted, released);
        });
        when(visitService.getAll(1L)).thenAnswer(inv -> {
            vitalsStarted.await(5, TimeUnit.SECONDS);
            throw new StoreException("Failed to fetch visits", new DataAccessResourceFailureException("reset"));
        });

        long startedAt = System.nanoTime();
        StoreException ex = assertThrows(StoreException.class, () -> service.getFullProfile(1L));

        assertEquals("Failed to fetch visits", ((StoreException) ex.getCause()).getCode());
        assertTrue(Duration.ofNanos(System.nanoTime() - startedAt).compareTo(Duration.ofSeconds(4)) < 0,
                "failure should not wait for the hung read");
        assertTrue(released.await(1, TimeUnit.SECONDS), "hung read still holds its thread");
        assertTrue(interrupted.get());
    }

    private static List<Vitals> hangUntilInterrupted(AtomicBoolean interrupted, CountDownLatch released) {
        try {
            Thread.sleep(10_000);
            return List.of();
        } catch (InterruptedException e) {
            interrupted.set(true);
            Thread.currentThread().interrupt();
            return List.of();
        } finally {
            released.countDown();
        }
    }

    private static void rendezvous(CountDownLatch latch) throws InterruptedException {
        latch.countDown();
        if (!latch.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("reads did not overlap");
        }
    }
}
