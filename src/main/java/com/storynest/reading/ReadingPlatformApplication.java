package com.storynest.reading;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReadingPlatformApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReadingPlatformApplication.class, args);
    }
}
