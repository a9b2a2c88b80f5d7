package com.jay.stfunnel.repository;

import com.jay.stfunnel.entity.StockScoreRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StockScoreRecordRepository extends JpaRepository<StockScoreRecord, Long> {

    List<StockScoreRecord> findByRunIdOrderByTotalScoreDesc(String runId);
}
