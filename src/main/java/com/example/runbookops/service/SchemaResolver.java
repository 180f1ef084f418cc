package com.example.runbookops.service;

import com.example.runbookops.domain.RunbookSchema;
import com.example.runbookops.exception.SchemaNotFoundException;
import com.example.runbookops.exception.ValidationException;
import com.example.runbookops.repository.RunbookSchemaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SchemaResolver {

    private final RunbookSchemaRepository repository;

    /**
     * @throws ValidationException when the id is blank or the schema is disabled
     * @throws SchemaNotFoundException when no schema has this id
     */
    public RunbookSchema resolve(String schemaId) {
        if (schemaId == null || schemaId.isBlank()) {
            throw new ValidationException("Schema id must be a non-empty string");
        }
        RunbookSchema schema = repository.findById(schemaId.trim())
                .orElseThrow(() -> new SchemaNotFoundException(schemaId));
        if (!schema.isEnabled()) {
            throw new ValidationException("Schema is disabled: " + schemaId);
        }
        return schema;
    }
}
