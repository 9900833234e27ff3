package com.devscontext.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.devscontext")
public class DevsContextApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(DevsContextApiApplication.class, args);
    }
}
