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
 * Vessel entity
 * Holds the principal particulars; hull geometry and loadcases reference it by id
 */
@Entity
@Table(name = "vessel")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vessel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 1000)
    private String description;

    /** Length between perpendiculars (m) */
    @Column(name = "lpp", precision = 12, scale = 6)
    private BigDecimal lpp;

    /** Moulded beam (m) */
    @Column(name = "beam", precision = 12, scale = 6)
    private BigDecimal beam;

    /** Design draft (m) */
    @Column(name = "design_draft", precision = 12, scale = 6)
    private BigDecimal designDraft;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
