package fpt.com.patientrecordservices.domain.serverinfo.service;

import fpt.com.patientrecordservices.common.config.ServerInfoProperties;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServerInfoServiceTest {

    @Test
    void getServerInfo_shouldAdvertiseConfiguredPortsAndAHost() {
        ServerInfoProperties properties = new ServerInfoProperties();
        properties.setApiPort(4001);
        properties.setAppPort(4000);

        Map<String, Object> info = new ServerInfoService(properties).getServerInfo();

        assertEquals(4001, info.get("apiPort"));
        assertEquals(4000, info.get("appPort"));
        String host = (String) info.get("host");
        assertNotNull(host);
        assertFalse(host.isBlank());
        assertFalse(host.startsWith("127."));
    }
}
