package com.deepansh.toolplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ToolCallPlannerApplication {
    public static void main(String[] args) {
        SpringApplication.run(ToolCallPlannerApplication.class, args);
    }
}
