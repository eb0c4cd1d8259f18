package fpt.com.patientrecordservices;

import fpt.com.patientrecordservices.common.config.ProfileProperties;
import fpt.com.patientrecordservices.common.config.ServerInfoProperties;
import fpt.com.patientrecordservices.common.storage.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({StorageProperties.class, ProfileProperties.class, ServerInfoProperties.class})
public class PatientRecordServicesApplication {

    private final Environment env;

    public PatientRecordServicesApplication(Environment env) {
        this.env = env;
    }

    public static void main(String[] args) {
        SpringApplication.run(PatientRecordServicesApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        String port = env.getProperty("local.server.port", env.getProperty("server.port", "3000"));
        log.info("API running on port {}", port);
    }
}
