package com.example.runbookops.repository;

import com.example.runbookops.domain.SettingEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SettingEntryRepository extends JpaRepository<SettingEntry, String> {
}
