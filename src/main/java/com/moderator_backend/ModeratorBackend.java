package com.moderator_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModeratorBackend {

    public static void main(String[] args) {
        SpringApplication.run(ModeratorBackend.class, args);
    }

}
