package com.bko.healthexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HealthExportApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthExportApplication.class, args);
    }
}
