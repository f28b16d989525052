package com.github.passthrough.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class PassthroughApplication {
    public static void main(String[] args) {
        SpringApplication.run(PassthroughApplication.class, args);
    }
}
