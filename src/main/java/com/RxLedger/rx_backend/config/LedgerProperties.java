package com.RxLedger.rx_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "rx.ledger")
@Data
public class LedgerProperties {

    public static final String DEFAULT_RPC_URL = "http://127.0.0.1:8545";

    public enum Mode {
        EMBEDDED,
        RPC
    }

    private Mode mode = Mode.EMBEDDED;
    private String rpcUrl = DEFAULT_RPC_URL;
    // bounds the liveness probe and the record fetch
    private Duration timeout = Duration.ofSeconds(5);
    private String contractAddress;
    private String privateKey;
    private long chainId = 31337L;
    private String ownerAddress = "0x0000000000000000000000000000000000000001";
    private int defaultExpiryDays = 30;
    private int defaultMaxUsage = 1;
    // registered at startup when not yet known to the ledger
    private List<String> seedDoctors = new ArrayList<>();
    private List<String> seedPharmacies = new ArrayList<>();
}
