package com.jay.stfunnel.repository;

import com.jay.stfunnel.entity.Holding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface HoldingRepository extends JpaRepository<Holding, Long> {

    List<Holding> findByPortfolioIdOrderByTickerAsc(Long portfolioId);

    Optional<Holding> findByPortfolioIdAndTicker(Long portfolioId, String ticker);
}
