package com.lynkvertx.navarch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import javax.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Loadcase entity
 * Water density and centre of gravity of one loading condition of a vessel
 */
@Entity
@Table(name = "loadcase")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Loadcase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vessel_id", nullable = false)
    private Long vesselId;

    @Column(nullable = false, length = 255)
    private String name;

    /** Water density (kg/m³) */
    @Column(name = "rho", precision = 10, scale = 4, nullable = false)
    private BigDecimal rho;

    /** Vertical centre of gravity above the keel (m) */
    @Column(name = "kg", precision = 12, scale = 6)
    private BigDecimal kg;

    /** Longitudinal centre of gravity from the aft station (m) */
    @Column(name = "lcg", precision = 12, scale = 6)
    private BigDecimal lcg;

    /** Target displacement (kg) */
    @Column(name = "target_displacement", precision = 18, scale = 3)
    private BigDecimal targetDisplacement;

    @Column(length = 1000)
    private String notes;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
