package com.alertrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AlertRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertRouterApplication.class, args);
    }
}
