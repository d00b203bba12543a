package com.jay.trendagent.repository;

import com.jay.trendagent.entity.SymbolOverride;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SymbolOverrideRepository extends JpaRepository<SymbolOverride, Long> {

    List<SymbolOverride> findByConfigIdAndBlockedTrue(String configId);
}
