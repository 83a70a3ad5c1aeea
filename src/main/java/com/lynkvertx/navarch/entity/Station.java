package com.lynkvertx.navarch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.math.BigDecimal;

/**
 * Station of a vessel's hull geometry: a transverse section at x (m) from the aft end
 */
@Entity
@Table(name = "station",
    uniqueConstraints = @UniqueConstraint(columnNames = {"vessel_id", "station_index"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Station {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vessel_id", nullable = false)
    private Long vesselId;

    @Column(name = "station_index", nullable = false)
    private Integer stationIndex;

    @Column(name = "x_coord", precision = 14, scale = 6, nullable = false)
    private BigDecimal x;
}
