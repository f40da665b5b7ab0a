package com.elevation.catalog.document;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration for catalog documents, feeds and lookup tables.
 * Documents are pretty printed; feed lines are compact.
 */
public final class CatalogJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private static final ObjectWriter DOCUMENT_WRITER = MAPPER.writerWithDefaultPrettyPrinter();
    private static final ObjectWriter LINE_WRITER = MAPPER.writer();

    private CatalogJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectWriter documentWriter() {
        return DOCUMENT_WRITER;
    }

    public static ObjectWriter lineWriter() {
        return LINE_WRITER;
    }
}
