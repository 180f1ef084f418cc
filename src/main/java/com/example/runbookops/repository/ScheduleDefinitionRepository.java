package com.example.runbookops.repository;

import com.example.runbookops.domain.ScheduleDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScheduleDefinitionRepository extends JpaRepository<ScheduleDefinition, String> {

    List<ScheduleDefinition> findByEnabledTrue();
}
