package com.connector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ConnectorRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConnectorRuntimeApplication.class, args);
    }

}
