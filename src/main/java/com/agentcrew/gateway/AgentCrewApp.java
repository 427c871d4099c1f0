package com.agentcrew.gateway;

import com.agentcrew.shared.config.ConfigLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.agentcrew.gateway")
public class AgentCrewApp {

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        var app = new SpringApplication(AgentCrewApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.run(args);
    }
}
