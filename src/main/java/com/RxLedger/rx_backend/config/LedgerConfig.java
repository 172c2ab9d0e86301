package com.RxLedger.rx_backend.config;

import com.RxLedger.rx_backend.ledger.InMemoryPrescriptionLedger;
import com.RxLedger.rx_backend.ledger.PrescriptionLedger;
import com.RxLedger.rx_backend.ledger.Web3jPrescriptionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;
import java.time.Duration;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class LedgerConfig {

    private final LedgerProperties ledgerProperties;

    @Bean
    public PrescriptionLedger prescriptionLedger(Clock clock) {
        if (ledgerProperties.getMode() == LedgerProperties.Mode.RPC) {
            return rpcLedger();
        }
        log.info("Using embedded prescription ledger, owner {}", ledgerProperties.getOwnerAddress());
        return new InMemoryPrescriptionLedger(ledgerProperties.getOwnerAddress(), clock);
    }

    @Bean
    public ThreadPoolTaskExecutor ledgerQueryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("ledger-query-");
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(100);
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    private PrescriptionLedger rpcLedger() {
        if (!StringUtils.hasText(ledgerProperties.getContractAddress())) {
            throw new IllegalStateException("rx.ledger.contract-address is required when rx.ledger.mode=rpc");
        }
        Duration timeout = ledgerProperties.getTimeout();
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
        Web3j web3j = Web3j.build(new HttpService(ledgerProperties.getRpcUrl(), httpClient));

        Credentials credentials = null;
        if (StringUtils.hasText(ledgerProperties.getPrivateKey())) {
            credentials = Credentials.create(ledgerProperties.getPrivateKey());
        } else {
            log.warn("No rx.ledger.private-key set; ledger submissions will be refused");
        }

        log.info("Using RPC prescription ledger at {} contract {}", ledgerProperties.getRpcUrl(),
                ledgerProperties.getContractAddress());
        return new Web3jPrescriptionLedger(web3j, ledgerProperties.getContractAddress(), credentials,
                ledgerProperties.getChainId());
    }
}
