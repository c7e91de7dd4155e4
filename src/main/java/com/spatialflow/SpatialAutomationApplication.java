package com.spatialflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpatialAutomationApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpatialAutomationApplication.class, args);
    }
}
