package com.lynkvertx.navarch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.math.BigDecimal;

/**
 * Waterline of a vessel's hull geometry: a horizontal plane at z (m) above the keel
 */
@Entity
@Table(name = "waterline",
    uniqueConstraints = @UniqueConstraint(columnNames = {"vessel_id", "waterline_index"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Waterline {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vessel_id", nullable = false)
    private Long vesselId;

    @Column(name = "waterline_index", nullable = false)
    private Integer waterlineIndex;

    @Column(name = "z_coord", precision = 14, scale = 6, nullable = false)
    private BigDecimal z;
}
