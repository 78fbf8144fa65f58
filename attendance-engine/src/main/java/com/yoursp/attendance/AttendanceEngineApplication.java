package com.yoursp.attendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AttendanceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttendanceEngineApplication.class, args);
    }
}
