package fpt.com.patientrecordservices.common.storage;

import fpt.com.patientrecordservices.common.exception.InvalidFileTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileStorageServiceTest {

    private static final long NOW = 1_700_000_000_000L;

    @TempDir
    Path root;

    private FileStorageService storage;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setRoot(root.toString());
        storage = new FileStorageService(properties, Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @Test
    void constructor_shouldCreateBothUploadDirectories() {
        assertTrue(Files.isDirectory(root.resolve("profilephotos")));
        assertTrue(Files.isDirectory(root.resolve("clinicaldocs")));
    }

    @Test
    void storeProfilePhoto_shouldNameFileAfterPatientAndTimestamp() throws IOException {
        MockMultipartFile photo = new MockMultipartFile("photo", "face.png", "image/png", new byte[]{1, 2, 3});

        String path = storage.storeProfilePhoto("42", photo);

        assertEquals("/uploads/profilephotos/patient_42_" + NOW + ".png", path);
        Path written = root.resolve("profilephotos").resolve("patient_42_" + NOW + ".png");
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(written));
    }

    @Test
    void storeProfilePhoto_shouldAcceptEveryAllowedImageType() {
        for (String type : new String[]{"image/jpeg", "image/jpg", "image/png", "image/webp"}) {
            MockMultipartFile photo = new MockMultipartFile("photo", "face.img", type, new byte[]{9});
            assertNotNull(storage.storeProfilePhoto("7", photo));
        }
    }

    @Test
    void storeProfilePhoto_shouldRejectNonImageWithoutWritingAnything() throws IOException {
        MockMultipartFile pdf = new MockMultipartFile("photo", "scan.pdf", "application/pdf", new byte[]{1});

        InvalidFileTypeException ex = assertThrows(InvalidFileTypeException.class,
                () -> storage.storeProfilePhoto("42", pdf));

        assertEquals("Invalid file type. Only images are allowed.", ex.getCode());
        try (Stream<Path> files = Files.list(root.resolve("profilephotos"))) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void storeProfilePhoto_shouldRejectMissingContentType() {
        MockMultipartFile unknown = new MockMultipartFile("photo", "face.png", null, new byte[]{1});

        assertThrows(InvalidFileTypeException.class, () -> storage.storeProfilePhoto("42", unknown));
    }

    @Test
    void storeClinicalDocument_shouldAcceptAnyTypeAndUseTimestampName() {
        MockMultipartFile doc = new MockMultipartFile("file", "report.pdf", "application/pdf", new byte[]{4, 5});

        String path = storage.storeClinicalDocument(doc);

        assertEquals("uploads/clinicaldocs/" + NOW + ".pdf", path);
        assertTrue(Files.exists(root.resolve("clinicaldocs").resolve(NOW + ".pdf")));
    }

    @Test
    void storeClinicalDocument_shouldNotOverwriteWhenTimestampCollides() throws IOException {
        MockMultipartFile first = new MockMultipartFile("file", "a.txt", "text/plain", "first".getBytes());
        MockMultipartFile second = new MockMultipartFile("file", "b.txt", "text/plain", "second".getBytes());

        String firstPath = storage.storeClinicalDocument(first);
        String secondPath = storage.storeClinicalDocument(second);

        assertNotEquals(firstPath, secondPath);
        assertEquals("uploads/clinicaldocs/" + (NOW + 1) + ".txt", secondPath);
        assertEquals("first", Files.readString(root.resolve("clinicaldocs").resolve(NOW + ".txt")));
    }

    @Test
    void extensionOf_shouldKeepDotAndIgnoreDirectories() {
        assertEquals(".jpeg", FileStorageService.extensionOf("C:\\photos\\me.jpeg"));
        assertEquals(".gz", FileStorageService.extensionOf("dir/archive.tar.gz"));
        assertEquals("", FileStorageService.extensionOf("README"));
        assertEquals("", FileStorageService.extensionOf(".bashrc"));
        assertEquals("", FileStorageService.extensionOf(null));
    }
}
