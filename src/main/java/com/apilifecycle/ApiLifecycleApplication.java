package com.apilifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiLifecycleApplication.class, args);
    }
}
