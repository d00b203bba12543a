package com.jay.trendagent.repository;

import com.jay.trendagent.entity.BrainSnapshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BrainSnapshotRepository extends JpaRepository<BrainSnapshotRecord, Long> {

    Optional<BrainSnapshotRecord> findTopByConfigIdOrderByCreatedAtDesc(String configId);
}
