package com.taskpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// Identity comes from bearer tokens only; no in-memory user store.
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class TaskPilotApplication {
    public static void main(String[] args) {
        SpringApplication.run(TaskPilotApplication.class, args);
    }
}
