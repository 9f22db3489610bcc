package com.riskscan.connect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RiskScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskScanApplication.class, args);
    }
}
