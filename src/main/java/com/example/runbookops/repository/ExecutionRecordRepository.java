package com.example.runbookops.repository;

import com.example.runbookops.domain.ExecutionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, String> {

    List<ExecutionRecord> findByPartitionKey(String partitionKey);

    List<ExecutionRecord> findByPartitionKeyAndExecIdOrderByRecordedAtAsc(String partitionKey, String execId);

    List<ExecutionRecord> findByExecIdOrderByRecordedAtAsc(String execId);
}
