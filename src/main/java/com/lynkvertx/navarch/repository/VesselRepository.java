package com.lynkvertx.navarch.repository;

import com.lynkvertx.navarch.entity.Vessel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VesselRepository extends JpaRepository<Vessel, Long> {

    List<Vessel> findAllByOrderByCreatedAtDesc();

    boolean existsByName(String name);
}
