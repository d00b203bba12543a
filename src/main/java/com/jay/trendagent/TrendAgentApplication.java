package com.jay.trendagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TrendAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(TrendAgentApplication.class, args);
    }
}
