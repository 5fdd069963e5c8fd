package com.coderelay.schema;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Forward change of the table layout from one version to the next.
 *
 * <p>A step runs inside a transaction opened by {@link SchemaManager}; it must not commit,
 * roll back or touch the version marker itself.
 */
@FunctionalInterface
public interface MigrationStep {

    void apply(Connection connection) throws SQLException;
}
