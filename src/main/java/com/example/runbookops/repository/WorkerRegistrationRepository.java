package com.example.runbookops.repository;

import com.example.runbookops.domain.WorkerRegistration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface WorkerRegistrationRepository
        extends JpaRepository<WorkerRegistration, WorkerRegistration.Key> {

    List<WorkerRegistration> findByCapability(String capability);

    List<WorkerRegistration> findAllByOrderByCapabilityAscWorkerIdAsc();

    @Modifying
    @Query("delete from WorkerRegistration w where w.lastSeen < :cutoff")
    int deleteByLastSeenBefore(@Param("cutoff") Instant cutoff);
}
