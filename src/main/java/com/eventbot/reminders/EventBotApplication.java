package com.eventbot.reminders;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EventBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventBotApplication.class, args);
    }
}
