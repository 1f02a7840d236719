package com.suitemender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SuiteMenderApplication {

    public static void main(String[] args) {
        SpringApplication.run(SuiteMenderApplication.class, args);
    }
}
