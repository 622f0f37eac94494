package com.geico.poc.schemaengine.snapshot;

import com.geico.poc.schemaengine.catalog.TableSchema;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * Canonical digest of a set of table definitions.
 *
 * The DDL texts are sorted before hashing, so the result does not depend on
 * the order tables were enumerated in.
 */
public final class SchemaHasher {

    static final String SEPARATOR = "|";

    private SchemaHasher() {
    }

    public static String calculateSchemaHash(Collection<TableSchema> schemas) {
        String canonical = schemas.stream()
            .map(s -> s.getCreateSql() != null ? s.getCreateSql() : "")
            .sorted()
            .collect(Collectors.joining(SEPARATOR));
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
