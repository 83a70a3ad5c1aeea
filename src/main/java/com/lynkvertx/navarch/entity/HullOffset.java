package com.lynkvertx.navarch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.*;
import java.math.BigDecimal;

/**
 * Half-breadth offset at a station/waterline intersection
 */
@Entity
@Table(name = "hull_offset",
    uniqueConstraints = @UniqueConstraint(columnNames = {"vessel_id", "station_index", "waterline_index"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HullOffset {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vessel_id", nullable = false)
    private Long vesselId;

    @Column(name = "station_index", nullable = false)
    private Integer stationIndex;

    @Column(name = "waterline_index", nullable = false)
    private Integer waterlineIndex;

    @Column(name = "half_breadth", precision = 14, scale = 6, nullable = false)
    private BigDecimal halfBreadth;
}
