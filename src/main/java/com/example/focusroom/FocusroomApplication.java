package com.example.focusroom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FocusroomApplication {

    public static void main(String[] args) {
        SpringApplication.run(FocusroomApplication.class, args);
    }
}
