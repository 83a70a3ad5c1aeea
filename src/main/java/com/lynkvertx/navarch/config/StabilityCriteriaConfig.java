package com.lynkvertx.navarch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Intact stability criteria thresholds.
 * Defaults follow IMO A.749(18) general criteria; override in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "navarch.stability.criteria")
public class StabilityCriteriaConfig {

    private String standard = "IMO A.749(18)";

    /** Area under GZ curve from 0° to 30° (m·rad) */
    private BigDecimal minArea030 = new BigDecimal("0.055");

    /** Area under GZ curve from 0° to 40° (m·rad) */
    private BigDecimal minArea040 = new BigDecimal("0.090");

    /** Area under GZ curve from 30° to 40° (m·rad) */
    private BigDecimal minArea3040 = new BigDecimal("0.030");

    /** Heel angle at which GZ peaks (deg) */
    private BigDecimal minAngleOfMaxGz = new BigDecimal("25");

    /** Initial transverse metacentric height (m) */
    private BigDecimal minInitialGmt = new BigDecimal("0.15");

    /** Righting arm at 30° heel (m) */
    private BigDecimal minGzAt30 = new BigDecimal("0.20");
}
