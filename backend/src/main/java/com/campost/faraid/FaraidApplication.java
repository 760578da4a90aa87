package com.campost.faraid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FaraidApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaraidApplication.class, args);
    }
}
