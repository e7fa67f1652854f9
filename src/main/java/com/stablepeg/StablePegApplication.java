package com.stablepeg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StablePegApplication {

    public static void main(String[] args) {
        SpringApplication.run(StablePegApplication.class, args);
    }
}
