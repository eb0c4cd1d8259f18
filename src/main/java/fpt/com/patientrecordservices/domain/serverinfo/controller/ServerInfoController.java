package fpt.com.patientrecordservices.domain.serverinfo.controller;

import fpt.com.patientrecordservices.domain.serverinfo.service.ServerInfoService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class ServerInfoController {

    private final ServerInfoService serverInfoService;

    public ServerInfoController(ServerInfoService serverInfoService) {
        this.serverInfoService = serverInfoService;
    }

    @GetMapping("/server-info")
    public Map<String, Object> serverInfo() {
        return serverInfoService.getServerInfo();
    }
}
