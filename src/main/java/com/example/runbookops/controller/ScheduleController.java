package com.example.runbookops.controller;

import com.example.runbookops.domain.ScheduleDefinition;
import com.example.runbookops.repository.ScheduleDefinitionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleDefinitionRepository repository;

    @GetMapping
    public ResponseEntity<List<ScheduleDefinition>> list() {
        return ResponseEntity.ok(repository.findAll());
    }
}
