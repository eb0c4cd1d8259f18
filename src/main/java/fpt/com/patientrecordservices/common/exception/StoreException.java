package fpt.com.patientrecordservices.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Database failure surfaced to the caller as a generic 500.
 * The code is the client-facing message, the cause stays server side.
 */
public class StoreException extends AppException {
    public StoreException(String code, Throwable cause) {
        super(code, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}
