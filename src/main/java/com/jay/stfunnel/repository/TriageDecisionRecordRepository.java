package com.jay.stfunnel.repository;

import com.jay.stfunnel.entity.TriageDecisionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TriageDecisionRecordRepository extends JpaRepository<TriageDecisionRecord, Long> {

    List<TriageDecisionRecord> findByRunId(String runId);
}
