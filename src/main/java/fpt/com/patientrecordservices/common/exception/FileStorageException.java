package fpt.com.patientrecordservices.common.exception;

import fpt.com.patientrecordservices.common.constants.Constants;
import org.springframework.http.HttpStatus;

public class FileStorageException extends AppException {
    public FileStorageException(Throwable cause) {
        super(Constants.MSG_FILE_STORAGE_FAILED, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}
