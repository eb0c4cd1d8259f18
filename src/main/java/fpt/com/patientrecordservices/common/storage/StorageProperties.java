package fpt.com.patientrecordservices.common.storage;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where uploaded files live on disk. Photos and clinical documents get a sub-directory each.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    private String root = "uploads";

    // Attempts made when a generated filename is already taken
    private int maxNameAttempts = 5;
}
