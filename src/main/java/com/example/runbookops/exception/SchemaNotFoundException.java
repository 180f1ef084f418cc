package com.example.runbookops.exception;

public class SchemaNotFoundException extends NotFoundException {

    public SchemaNotFoundException(String schemaId) {
        super("Schema not found: " + schemaId);
    }
}
