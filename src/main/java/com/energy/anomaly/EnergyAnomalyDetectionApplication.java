package com.energy.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class EnergyAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyAnomalyDetectionApplication.class, args);
    }
}
