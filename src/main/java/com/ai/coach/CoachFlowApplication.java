package com.ai.coach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoachFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoachFlowApplication.class, args);
    }
}
