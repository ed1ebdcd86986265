package com.gillianbc.annuity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AnnuityApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnnuityApplication.class, args);
    }
}
