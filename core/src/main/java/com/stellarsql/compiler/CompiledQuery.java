package com.stellarsql.compiler;

import com.stellarsql.generator.GeneratedSQL;
import com.stellarsql.schema.OutputColumn;

import java.util.List;
import java.util.Objects;

/**
 * The result of compiling one ADQL query.
 *
 * @param generated the PostgreSQL statement and its bound parameters
 * @param outputColumns the result schema, one entry per output column
 * @param catalogVersion the version of the catalog snapshot the query was compiled against
 */
public record CompiledQuery(GeneratedSQL generated, List<OutputColumn> outputColumns, long catalogVersion) {

    public CompiledQuery {
        Objects.requireNonNull(generated, "generated");
        outputColumns = List.copyOf(outputColumns);
    }

    /** Returns the statement, with placeholders for the parameters. */
    public String sql() {
        return generated.sql();
    }

    /** Returns the values to bind, in placeholder order. */
    public List<Object> parameters() {
        return generated.parameters();
    }

    /**
     * Returns the statement with the parameters written in as literals, for
     * logs and debugging.
     */
    public String inlinedSql() {
        return generated.inlinedSql();
    }
}
