package com.example.OfferScan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OfferScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(OfferScanApplication.class, args);
    }
}
