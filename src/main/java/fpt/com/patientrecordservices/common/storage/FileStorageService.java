package fpt.com.patientrecordservices.common.storage;

import fpt.com.patientrecordservices.common.constants.Constants;
import fpt.com.patientrecordservices.common.exception.FileStorageException;
import fpt.com.patientrecordservices.common.exception.InvalidFileTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.function.LongFunction;

/**
 * Writes uploaded files to disk and hands back the relative path that gets stored with the row.
 * Files are always written before the row is inserted; a failed insert leaves the file behind.
 */
@Slf4j
@Service
public class FileStorageService {

    private final Clock clock;
    private final int maxNameAttempts;
    private final Path profilePhotosDir;
    private final Path clinicalDocsDir;

    public FileStorageService(StorageProperties properties, Clock clock) {
        this.clock = clock;
        this.maxNameAttempts = Math.max(1, properties.getMaxNameAttempts());
        Path root = Path.of(properties.getRoot()).toAbsolutePath().normalize();
        this.profilePhotosDir = root.resolve(Constants.PROFILE_PHOTOS_DIR);
        this.clinicalDocsDir = root.resolve(Constants.CLINICAL_DOCS_DIR);
        try {
            Files.createDirectories(profilePhotosDir);
            Files.createDirectories(clinicalDocsDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create upload directories under " + root, e);
        }
        log.info("Upload directories ready: {} , {}", profilePhotosDir, clinicalDocsDir);
    }

    /**
     * Validates and stores a profile photo.
     *
     * @param patientKey patient id, or {@link Constants#NEW_PATIENT_KEY} during intake
     * @return path of the form {@code /uploads/profilephotos/patient_{key}_{millis}.{ext}}
     * @throws InvalidFileTypeException if the declared type is not an accepted image type
     */
    public String storeProfilePhoto(String patientKey, MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType == null || !Constants.ALLOWED_PHOTO_TYPES.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new InvalidFileTypeException(contentType);
        }
        String ext = extensionOf(file.getOriginalFilename());
        String filename = write(profilePhotosDir, file, ts -> "patient_" + patientKey + "_" + ts + ext);
        return Constants.PROFILE_PHOTO_PATH_PREFIX + filename;
    }

    /**
     * Stores a clinical document of any type.
     *
     * @return path of the form {@code uploads/clinicaldocs/{millis}.{ext}}
     */
    public String storeClinicalDocument(MultipartFile file) {
        String ext = extensionOf(file.getOriginalFilename());
        String filename = write(clinicalDocsDir, file, ts -> ts + ext);
        return Constants.CLINICAL_DOC_PATH_PREFIX + filename;
    }

    /**
     * Logs a stored file whose database row could not be written.
     */
    public void reportOrphan(String relativePath) {
        log.warn("Uploaded file left without a database row: {}", relativePath);
    }

    public Path getProfilePhotosDir() {
        return profilePhotosDir;
    }

    public Path getClinicalDocsDir() {
        return clinicalDocsDir;
    }

    private String write(Path dir, MultipartFile file, LongFunction<String> namer) {
        long timestamp = clock.millis();
        for (int attempt = 0; attempt < maxNameAttempts; attempt++) {
            String filename = namer.apply(timestamp + attempt);
            Path target = dir.resolve(filename);
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target);
                log.debug("Stored upload {} ({} bytes)", target, file.getSize());
                return filename;
            } catch (FileAlreadyExistsException e) {
                log.debug("Name {} already taken, retrying", filename);
            } catch (IOException e) {
                log.error("Error writing upload to {}", target, e);
                throw new FileStorageException(e);
            }
        }
        log.error("No free file name in {} after {} attempts", dir, maxNameAttempts);
        throw new FileStorageException(new FileAlreadyExistsException(
                dir.toString(), null, "no free name after " + maxNameAttempts + " attempts"));
    }

    // Extension of the original name including the dot, empty when there is none
    static String extensionOf(String originalFilename) {
        String name = StringUtils.getFilename(originalFilename);
        if (name == null) {
            return "";
        }
        name = name.substring(name.lastIndexOf('\\') + 1);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot);
    }
}
