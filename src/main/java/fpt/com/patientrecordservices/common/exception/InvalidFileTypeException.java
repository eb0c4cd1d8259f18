package fpt.com.patientrecordservices.common.exception;

import fpt.com.patientrecordservices.common.constants.Constants;

import java.util.Map;

/**
 * Raised by the upload path when a profile photo is not one of the accepted image types.
 * Nothing has been written to disk or to the database when this is thrown.
 */
public class InvalidFileTypeException extends BadRequestException {
    public InvalidFileTypeException(String contentType) {
        super(Constants.MSG_INVALID_FILE_TYPE, Map.of("contentType", String.valueOf(contentType)));
    }
}
