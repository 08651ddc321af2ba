package com.example.leads;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeadConsoleApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadConsoleApplication.class, args);
    }
}
