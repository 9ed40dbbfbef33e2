package com.signalfusion.drift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriftMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftMonitorApplication.class, args);
    }
}
