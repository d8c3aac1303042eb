package io.snapshots.sink;

import java.util.Objects;

public record ColumnSpec(String name, ColumnType type, boolean nullable) {
    public ColumnSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public String ddl() {
        return name + " " + type.sqlType() + (nullable ? "" : " NOT NULL");
    }
}
