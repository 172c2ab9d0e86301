package com.RxLedger.rx_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RxBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(RxBackendApplication.class, args);
    }
}
