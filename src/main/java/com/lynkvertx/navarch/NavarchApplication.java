package com.lynkvertx.navarch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * NAVARCH - Naval Architecture Hydrostatics Engine
 * Vessel geometry, hydrostatic tables, trim equilibrium and intact stability
 */
@SpringBootApplication
public class NavarchApplication {

    public static void main(String[] args) {
        SpringApplication.run(NavarchApplication.class, args);
    }
}
