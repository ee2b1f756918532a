package com.tradescan.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradeScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeScanApplication.class, args);
    }
}
