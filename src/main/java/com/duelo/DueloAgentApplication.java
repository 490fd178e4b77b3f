package com.duelo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DueloAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(DueloAgentApplication.class, args);
    }
}
