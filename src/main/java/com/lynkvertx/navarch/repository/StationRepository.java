package com.lynkvertx.navarch.repository;

import com.lynkvertx.navarch.entity.Station;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StationRepository extends JpaRepository<Station, Long> {

    List<Station> findByVesselIdOrderByStationIndexAsc(Long vesselId);

    void deleteByVesselId(Long vesselId);
}
