package com.example.marketdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketDataGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketDataGatewayApplication.class, args);
    }
}
