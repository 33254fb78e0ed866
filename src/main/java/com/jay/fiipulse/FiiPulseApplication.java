package com.jay.fiipulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FiiPulseApplication {
    public static void main(String[] args) {
        SpringApplication.run(FiiPulseApplication.class, args);
    }
}
