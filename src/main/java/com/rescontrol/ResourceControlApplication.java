package com.rescontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ResourceControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResourceControlApplication.class, args);
    }
}
