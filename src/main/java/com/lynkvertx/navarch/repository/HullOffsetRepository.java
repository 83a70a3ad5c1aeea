package com.lynkvertx.navarch.repository;

import com.lynkvertx.navarch.entity.HullOffset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Hull offset repository
 */
@Repository
public interface HullOffsetRepository extends JpaRepository<HullOffset, Long> {

    List<HullOffset> findByVesselIdOrderByStationIndexAscWaterlineIndexAsc(Long vesselId);

    void deleteByVesselId(Long vesselId);
}
