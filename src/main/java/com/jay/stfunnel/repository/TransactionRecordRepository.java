package com.jay.stfunnel.repository;

import com.jay.stfunnel.entity.TransactionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransactionRecordRepository extends JpaRepository<TransactionRecord, Long> {

    List<TransactionRecord> findByPortfolioIdOrderByExecutedAtDesc(Long portfolioId);
}
