package com.govsignal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GovernanceSignalApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernanceSignalApplication.class, args);
    }
}
