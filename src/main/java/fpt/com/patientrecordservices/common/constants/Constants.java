package fpt.com.patientrecordservices.common.constants;

import java.util.Set;

/**
 * Shared constants for the whole service.
 */
public final class Constants {

    private Constants() {}

    // Upload locations, relative to the storage root
    public static final String PROFILE_PHOTOS_DIR = "profilephotos";
    public static final String CLINICAL_DOCS_DIR = "clinicaldocs";

    // Paths persisted in the database and served back as static content
    public static final String PROFILE_PHOTO_PATH_PREFIX = "/uploads/profilephotos/";
    public static final String CLINICAL_DOC_PATH_PREFIX = "uploads/clinicaldocs/";

    // Used in the photo filename while the patient row does not exist yet
    public static final String NEW_PATIENT_KEY = "new";

    public static final Set<String> ALLOWED_PHOTO_TYPES =
            Set.of("image/jpeg", "image/png", "image/jpg", "image/webp");

    // Client-facing messages
    public static final String MSG_INVALID_FILE_TYPE = "Invalid file type. Only images are allowed.";
    public static final String MSG_NO_FILE_UPLOADED = "No file uploaded";
    public static final String MSG_PATIENT_NOT_FOUND = "Patient not found";
    public static final String MSG_FILE_STORAGE_FAILED = "Failed to store uploaded file";
    public static final String MSG_FILE_TOO_LARGE = "Uploaded file is too large";
    public static final String MSG_INTERNAL_ERROR = "Internal Server Error";
}
