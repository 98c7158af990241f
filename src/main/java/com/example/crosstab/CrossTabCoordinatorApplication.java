package com.example.crosstab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CrossTabCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrossTabCoordinatorApplication.class, args);
    }
}
