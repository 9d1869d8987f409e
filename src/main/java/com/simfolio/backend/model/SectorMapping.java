package com.simfolio.backend.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Operator-maintained sector override; wins over whatever the market-data provider reports.
 */
@Entity
@Table(name = "sector_mappings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectorMapping {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 32)
    private String symbol;

    @Column(nullable = false, length = 128)
    private String sector;
}
