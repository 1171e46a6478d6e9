package com.bko.coachbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CoachBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoachBotApplication.class, args);
    }
}
