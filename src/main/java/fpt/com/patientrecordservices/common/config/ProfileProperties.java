package fpt.com.patientrecordservices.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.profile")
public class ProfileProperties {

    private Duration queryTimeout = Duration.ofSeconds(30);

    private int corePoolSize = 8;
    private int maxPoolSize = 16;
    private int queueCapacity = 200;
}
