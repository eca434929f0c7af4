package com.github.dimitryivaniuta.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FrequencySchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FrequencySchedulerApplication.class, args);
    }
}
