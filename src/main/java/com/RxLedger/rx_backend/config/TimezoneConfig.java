package com.RxLedger.rx_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.TimeZone;

@Configuration
@Slf4j
public class TimezoneConfig {

    @PostConstruct
    public void init() {
        // Ledger expiry is unix seconds; keep every rendered timestamp in UTC as well
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
