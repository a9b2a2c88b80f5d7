package com.jay.stfunnel.repository;

import com.jay.stfunnel.entity.StockAnalysisRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StockAnalysisRecordRepository extends JpaRepository<StockAnalysisRecord, Long> {

    Optional<StockAnalysisRecord> findByRunIdAndTicker(String runId, String ticker);

    List<StockAnalysisRecord> findByRunIdOrderByConvictionScoreDesc(String runId);
}
