package com.RxLedger.rx_backend.repository;

import com.RxLedger.rx_backend.model.IntegrityAlert;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface IntegrityAlertRepository extends JpaRepository<IntegrityAlert, UUID> {

    List<IntegrityAlert> findAllByOrderByDetectedAtDesc(Pageable pageable);

    List<IntegrityAlert> findByBlockchainId(String blockchainId);
}
