package com.jay.stfunnel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StockFunnelApplication {
    public static void main(String[] args) {
        SpringApplication.run(StockFunnelApplication.class, args);
    }
}
