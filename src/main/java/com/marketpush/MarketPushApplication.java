package com.marketpush;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketPushApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketPushApplication.class, args);
    }
}
