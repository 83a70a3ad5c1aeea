package com.lynkvertx.navarch.repository;

import com.lynkvertx.navarch.entity.Loadcase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LoadcaseRepository extends JpaRepository<Loadcase, Long> {

    List<Loadcase> findByVesselIdOrderByIdAsc(Long vesselId);

    /**
     * Find a loadcase only if it belongs to the given vessel
     */
    Optional<Loadcase> findByIdAndVesselId(Long id, Long vesselId);

    void deleteByVesselId(Long vesselId);
}
