package com.fairwaytour;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FairwayTourApplication {
    public static void main(String[] args) {
        SpringApplication.run(FairwayTourApplication.class, args);
    }
}
