package com.scanpda.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScanpdaServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanpdaServerApplication.class, args);
    }
}
