package com.stockneuro.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StockNeuroApplication {
    public static void main(String[] args) {
        SpringApplication.run(StockNeuroApplication.class, args);
    }
}
