package com.jay.trendagent.repository;

import com.jay.trendagent.entity.EquityPoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EquityPointRepository extends JpaRepository<EquityPoint, Long> {

    Optional<EquityPoint> findTopByConfigIdOrderByPointTimeDesc(String configId);
}
