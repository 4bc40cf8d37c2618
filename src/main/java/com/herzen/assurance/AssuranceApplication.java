package com.herzen.assurance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AssuranceApplication {
    public static void main(String[] args) {
        SpringApplication.run(AssuranceApplication.class, args);
    }
}
