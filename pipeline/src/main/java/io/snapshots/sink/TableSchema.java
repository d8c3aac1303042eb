package io.snapshots.sink;

import io.snapshots.core.TimeScope;
import io.snapshots.core.UpsertKey;
import io.snapshots.error.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Target table description: ordered columns, upsert key, version column, optional recorded-at column with the
 * bucket columns derived from it, and the load strategy.
 */
public final class TableSchema {
    private final String table;
    private final List<ColumnSpec> columns;
    private final Map<String, ColumnSpec> byName;
    private final UpsertKey key;
    private final String versionColumn;
    private final String recordedAtColumn;
    private final List<BucketColumn> buckets;
    private final LoadStrategy strategy;

    private TableSchema(Builder b) {
        this.table = b.table;
        this.columns = List.copyOf(b.columns.values());
        this.byName = Map.copyOf(b.columns);
        this.key = b.key;
        this.versionColumn = b.versionColumn;
        this.recordedAtColumn = b.recordedAtColumn;
        this.buckets = List.copyOf(b.buckets);
        this.strategy = b.strategy;
    }

    public static Builder builder(String table) { return new Builder(table); }

    public String table() { return table; }
    public List<ColumnSpec> columns() { return columns; }
    public UpsertKey key() { return key; }
    public String versionColumn() { return versionColumn; }
    public Optional<String> recordedAtColumn() { return Optional.ofNullable(recordedAtColumn); }
    public List<BucketColumn> buckets() { return buckets; }
    public LoadStrategy strategy() { return strategy; }

    public ColumnSpec column(String name) {
        ColumnSpec c = byName.get(name);
        if (c == null) throw new ConfigurationException("table " + table + " has no column " + name);
        return c;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSpec::name).collect(Collectors.toList());
    }

    public boolean isKeyColumn(String name) { return key.columns().contains(name); }

    /** Portable DDL. Delete/insert tables get a primary key on the upsert key. */
    public String createTableSql() {
        StringBuilder sb = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(table).append(" (");
        sb.append(columns.stream().map(ColumnSpec::ddl).collect(Collectors.joining(", ")));
        if (strategy == LoadStrategy.DELETE_INSERT) {
            sb.append(", PRIMARY KEY (").append(String.join(", ", key.columns())).append(")");
        }
        return sb.append(")").toString();
    }

    @Override
    public String toString() {
        return "TableSchema[" + table + " key=" + key.columns() + " version=" + versionColumn + " " + strategy + "]";
    }

    public static final class Builder {
        private final String table;
        private final Map<String, ColumnSpec> columns = new LinkedHashMap<>();
        private final List<BucketColumn> buckets = new ArrayList<>();
        private UpsertKey key;
        private String versionColumn;
        private String recordedAtColumn;
        private LoadStrategy strategy = LoadStrategy.DELETE_INSERT;

        private Builder(String table) {
            if (table == null || !table.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                throw new ConfigurationException("invalid table name: " + table);
            }
            this.table = table;
        }

        public Builder column(String name, ColumnType type) { return add(new ColumnSpec(name, type, true)); }
        public Builder required(String name, ColumnType type) { return add(new ColumnSpec(name, type, false)); }

        public Builder bucket(String name, TimeScope scope, ColumnType type) {
            if (type != ColumnType.TIMESTAMP && type != ColumnType.DATE && type != ColumnType.STRING) {
                throw new ConfigurationException("bucket column " + name + " must be TIMESTAMP, DATE or STRING");
            }
            buckets.add(new BucketColumn(name, scope));
            return add(new ColumnSpec(name, type, false));
        }

        public Builder key(String... cols) { this.key = UpsertKey.of(cols); return this; }
        public Builder version(String col) { this.versionColumn = col; return this; }
        public Builder recordedAt(String col) { this.recordedAtColumn = col; return this; }
        public Builder strategy(LoadStrategy s) { this.strategy = Objects.requireNonNull(s, "strategy"); return this; }

        private Builder add(ColumnSpec c) {
            if (!c.name().matches("[A-Za-z_][A-Za-z0-9_]*")) throw new ConfigurationException("invalid column name: " + c.name());
            if (columns.putIfAbsent(c.name(), c) != null) throw new ConfigurationException("duplicate column " + c.name() + " in " + table);
            return this;
        }

        public TableSchema build() {
            if (key == null) throw new ConfigurationException("table " + table + " needs an upsert key");
            for (String k : key.columns()) {
                if (!columns.containsKey(k)) throw new ConfigurationException("key column " + k + " not in table " + table);
            }
            if (versionColumn == null) throw new ConfigurationException("table " + table + " needs a version column");
            ColumnSpec v = columns.get(versionColumn);
            if (v == null || v.type() != ColumnType.LONG) {
                throw new ConfigurationException("version column " + versionColumn + " of " + table + " must be a LONG column");
            }
            if (recordedAtColumn != null) {
                ColumnSpec r = columns.get(recordedAtColumn);
                if (r == null || r.type() != ColumnType.TIMESTAMP) {
                    throw new ConfigurationException("recorded-at column " + recordedAtColumn + " of " + table + " must be a TIMESTAMP column");
                }
            } else if (!buckets.isEmpty()) {
                throw new ConfigurationException("bucket columns of " + table + " need a recorded-at column");
            }
            return new TableSchema(this);
        }
    }
}
