package com.RxLedger.rx_backend.model;

import com.RxLedger.rx_backend.enums.PrescriptionStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "prescriptions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Prescription {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // short code, joins to the ledger record
    @Column(nullable = false, unique = true, length = 31)
    private String blockchainId;

    @Column(nullable = false)
    private String doctorAddress;

    @Column(nullable = false)
    private String patientName;

    @Column(nullable = false)
    private String patientAge;

    private String diagnosis;
    private String allergies;

    @Column(length = 1000)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private PrescriptionStatus status = PrescriptionStatus.CREATED;

    @Builder.Default
    private long usageCount = 0L;

    @Builder.Default
    private long maxUsage = 1L;

    @Column(nullable = false)
    private LocalDateTime expiryDate;

    // commitments as submitted at issuance
    @Column(length = 66)
    private String patientHash;

    @Column(length = 66)
    private String medicationHash;

    @Builder.Default
    private boolean blockchainSynced = false;

    private String issueTxHash;
    private String confirmedTxHash;
    private String dispensedBy;
    private LocalDateTime dispensedAt;

    @OneToMany(mappedBy = "prescription", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderColumn(name = "line_index")
    @Builder.Default
    private List<PrescriptionItem> items = new ArrayList<>();

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime issuedAt;
}
