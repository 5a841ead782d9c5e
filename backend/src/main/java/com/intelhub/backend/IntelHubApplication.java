package com.intelhub.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IntelHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntelHubApplication.class, args);
    }
}
