package com.example.runbookops.repository;

import com.example.runbookops.domain.QueueMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface QueueMessageRepository extends JpaRepository<QueueMessage, String> {

    @Query("select m from QueueMessage m where m.queueName = :queue and m.visibleAt <= :now order by m.enqueuedAt asc")
    List<QueueMessage> findVisible(@Param("queue") String queueName, @Param("now") Instant now, Pageable page);

    /**
     * Moves {@code visibleAt} only while the claim identified by {@code version} is still current.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update QueueMessage m set m.visibleAt = :visibleAt, m.version = m.version + 1 "
            + "where m.id = :id and m.version = :version")
    int extendClaim(@Param("id") String id, @Param("version") long version, @Param("visibleAt") Instant visibleAt);

    long countByQueueName(String queueName);
}
