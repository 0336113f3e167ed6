package io.cloudapis.athena.valueobject;

import io.cloudapis.json.spi.ObjectNode;

import java.util.Objects;

/**
 * The database and data catalog context in which a query runs.
 */
public final class QueryExecutionContext {

    private final String database;
    private final String catalog;

    private QueryExecutionContext(String database, String catalog) {
        this.database = database;
        this.catalog = catalog;
    }

    public static QueryExecutionContext of(String database, String catalog) {
        return new QueryExecutionContext(database, catalog);
    }

    public static QueryExecutionContext ofDatabase(String database) {
        return new QueryExecutionContext(database, null);
    }

    public String getDatabase() {
        return database;
    }

    public String getCatalog() {
        return catalog;
    }

    public void requestBody(ObjectNode node) {
        if (database != null) {
            node.put("Database", database);
        }
        if (catalog != null) {
            node.put("Catalog", catalog);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof QueryExecutionContext)) return false;
        QueryExecutionContext other = (QueryExecutionContext) obj;
        return Objects.equals(database, other.database) && Objects.equals(catalog, other.catalog);
    }

    @Override
    public int hashCode() {
        return Objects.hash(database, catalog);
    }
}
