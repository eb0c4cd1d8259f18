package fpt.com.patientrecordservices.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ports advertised by {@code GET /server-info} to clients on the local network.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.server-info")
public class ServerInfoProperties {

    private int apiPort = 3001;
    private int appPort = 3000;
}
