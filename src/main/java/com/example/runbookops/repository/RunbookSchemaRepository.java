package com.example.runbookops.repository;

import com.example.runbookops.domain.RunbookSchema;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RunbookSchemaRepository extends JpaRepository<RunbookSchema, String> {
}
