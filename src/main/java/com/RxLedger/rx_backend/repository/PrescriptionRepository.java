package com.RxLedger.rx_backend.repository;

import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import com.RxLedger.rx_backend.model.Prescription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PrescriptionRepository extends JpaRepository<Prescription, UUID> {

    Optional<Prescription> findByBlockchainId(String blockchainId);

    boolean existsByBlockchainId(String blockchainId);

    List<Prescription> findByDoctorAddressOrderByIssuedAtDesc(String doctorAddress);

    long countByStatus(PrescriptionStatus status);

    @Modifying
    @Query("""
        UPDATE Prescription p SET p.status = com.RxLedger.rx_backend.enums.PrescriptionStatus.EXPIRED
        WHERE p.expiryDate < :now AND p.status IN :statuses
    """)
    int markExpired(@Param("now") LocalDateTime now, @Param("statuses") Collection<PrescriptionStatus> statuses);

    /**
     * Applies one ledger dispense receipt. Guarded by the allowed source statuses and by
     * the usage count, so a receipt older than the stored state never overwrites it.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Prescription p SET p.status = :next, p.usageCount = :usageCount, p.dispensedAt = :dispensedAt,
            p.dispensedBy = :dispensedBy, p.confirmedTxHash = :txHash, p.blockchainSynced = true
        WHERE p.blockchainId = :blockchainId AND p.status IN :allowedFrom AND p.usageCount < :usageCount
    """)
    int recordDispense(@Param("blockchainId") String blockchainId,
                       @Param("next") PrescriptionStatus next,
                       @Param("allowedFrom") Collection<PrescriptionStatus> allowedFrom,
                       @Param("usageCount") long usageCount,
                       @Param("dispensedAt") LocalDateTime dispensedAt,
                       @Param("dispensedBy") String dispensedBy,
                       @Param("txHash") String txHash);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Prescription p SET p.status = :next
        WHERE p.blockchainId = :blockchainId AND p.status IN :allowedFrom
    """)
    int updateStatus(@Param("blockchainId") String blockchainId,
                     @Param("next") PrescriptionStatus next,
                     @Param("allowedFrom") Collection<PrescriptionStatus> allowedFrom);
}
