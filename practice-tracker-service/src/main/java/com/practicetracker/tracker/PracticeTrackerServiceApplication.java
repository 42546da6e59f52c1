package com.practicetracker.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PracticeTrackerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PracticeTrackerServiceApplication.class, args);
    }
}
