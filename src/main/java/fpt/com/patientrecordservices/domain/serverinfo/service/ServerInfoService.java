package fpt.com.patientrecordservices.domain.serverinfo.service;

import fpt.com.patientrecordservices.common.config.ServerInfoProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lets clients on the local network find this API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServerInfoService {

    static final String FALLBACK_HOST = "localhost";

    private final ServerInfoProperties properties;

    public Map<String, Object> getServerInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("host", resolveLanAddress());
        info.put("apiPort", properties.getApiPort());
        info.put("appPort", properties.getAppPort());
        return info;
    }

    // First non-loopback IPv4 address of an interface that is up
    String resolveLanAddress() {
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nic.isUp() || nic.isLoopback()) {
                    continue;
                }
                for (InetAddress address : Collections.list(nic.getInetAddresses())) {
                    if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
                        return address.getHostAddress();
                    }
                }
            }
        } catch (SocketException e) {
            log.warn("Cannot list network interfaces, advertising {}", FALLBACK_HOST, e);
        }
        return FALLBACK_HOST;
    }
}
