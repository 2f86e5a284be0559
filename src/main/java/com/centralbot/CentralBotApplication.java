package com.centralbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CentralBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CentralBotApplication.class, args);
    }
}
