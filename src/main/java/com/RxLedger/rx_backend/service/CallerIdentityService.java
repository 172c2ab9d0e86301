package com.RxLedger.rx_backend.service;

import com.RxLedger.rx_backend.config.SecurityUsersConfig;
import com.RxLedger.rx_backend.exception.ApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class CallerIdentityService {

    private final SecurityUsersConfig securityUsersConfig;

    /**
     * The ledger address bound to the authenticated user. An address named in the request
     * body is only accepted when it is that same address.
     */
    public String resolveLedgerAddress(Authentication authentication, String requestedAddress) {
        String username = authentication.getName();
        String bound = securityUsersConfig.getUsers().stream()
                .filter(user -> username.equals(user.getUsername()))
                .map(SecurityUsersConfig.UserEntry::getAddress)
                .filter(Objects::nonNull)
                .map(address -> address.toLowerCase(Locale.ROOT))
                .findFirst()
                .orElseThrow(() -> new ApiException("User " + username + " has no ledger address",
                        HttpStatus.FORBIDDEN, "NO_LEDGER_ADDRESS"));

        if (requestedAddress != null && !requestedAddress.equalsIgnoreCase(bound)) {
            log.warn("User {} asked to act as {} but is bound to {}", username, requestedAddress, bound);
            throw new ApiException("Address " + requestedAddress + " does not belong to user " + username,
                    HttpStatus.FORBIDDEN, "ADDRESS_MISMATCH");
        }
        return bound;
    }
}
