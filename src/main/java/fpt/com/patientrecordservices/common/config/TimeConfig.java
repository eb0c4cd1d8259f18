package fpt.com.patientrecordservices.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    // Source of every server-assigned timestamp (recorded_at, upload_date, created_at, file names)
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
