package com.jay.stfunnel.repository;

import com.jay.stfunnel.entity.ScreeningRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScreeningRunRepository extends JpaRepository<ScreeningRun, String> {

    List<ScreeningRun> findByPortfolioIdOrderByStartedAtDesc(Long portfolioId);
}
