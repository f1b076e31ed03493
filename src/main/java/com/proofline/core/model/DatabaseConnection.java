package com.proofline.core.model;

import com.proofline.core.source.SourceDialect;

/**
 * Source database descriptor. Read-only input to the fetch and resync engines.
 */
public record DatabaseConnection(
    long id,
    SourceDialect dialect,
    String host,
    Integer port,
    String databaseName,
    String user,
    String password
) {

    @Override
    public String toString() {
        return "DatabaseConnection[id=" + id + ", dialect=" + dialect + ", host=" + host
                + ", port=" + port + ", databaseName=" + databaseName + ", user=" + user + "]";
    }
}
