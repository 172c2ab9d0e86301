package com.RxLedger.rx_backend.model;

import com.RxLedger.rx_backend.enums.ChainErrorCode;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "integrity_alerts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IntegrityAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChainErrorCode code;

    @Column(nullable = false)
    private String blockchainId;

    private String actorAddress;

    @Column(length = 2000)
    private String description;

    private boolean patientMatch;
    private boolean medMatch;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime detectedAt;
}
