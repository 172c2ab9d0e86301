package com.RxLedger.rx_backend.config;

import com.RxLedger.rx_backend.enums.Role;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "rx.security")
@Data
public class SecurityUsersConfig {

    private List<UserEntry> users = new ArrayList<>();

    @Data
    public static class UserEntry {
        private String username;
        private String password;
        private Role role;
        // ledger account the user acts as (DOCTOR and PHARMACY accounts)
        private String address;
        // only for PATIENT accounts: the prescription code they may read
        private String linkedPrescriptionId;
    }
}
