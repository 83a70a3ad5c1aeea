package com.lynkvertx.navarch.repository;

import com.lynkvertx.navarch.entity.Waterline;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WaterlineRepository extends JpaRepository<Waterline, Long> {

    List<Waterline> findByVesselIdOrderByWaterlineIndexAsc(Long vesselId);

    void deleteByVesselId(Long vesselId);
}
