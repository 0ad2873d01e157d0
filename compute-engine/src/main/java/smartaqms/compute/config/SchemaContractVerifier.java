package smartaqms.compute.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Comprobación de arranque ("Fail Fast") del {@link SchemaContract}.
 * <p>
 * Se ejecuta una sola vez, antes que los ciclos analíticos. Si falta una tabla, una columna,
 * una clave única o una clave foránea el arranque se aborta: nunca se comprueba el esquema por
 * petición.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class SchemaContractVerifier implements ApplicationRunner {

    private final DataSource dataSource;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        log.info(">>> BOOTSTRAP: Verificando contrato de esquema v{}...", SchemaContract.VERSION);
        List<String> violations = verify();
        if (!violations.isEmpty()) {
            violations.forEach(v -> log.error(">>> FATAL: {}", v));
            throw new IllegalStateException("Schema contract v" + SchemaContract.VERSION
                    + " violated: " + String.join("; ", violations));
        }
        log.info(">>> BOOTSTRAP: Esquema conforme ({} tablas, {} claves foráneas).",
                SchemaContract.TABLES.size(), SchemaContract.FOREIGN_KEYS.size());
    }

    public List<String> verify() throws SQLException {
        List<String> violations = new ArrayList<>();
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData meta = connection.getMetaData();
            Map<String, String> actualTables = tableNames(meta);

            SchemaContract.TABLES.forEach((table, required) -> {
                String actual = actualTables.get(table);
                if (actual == null) {
                    violations.add("missing table " + table);
                    return;
                }
                try {
                    Set<String> columns = columnNames(meta, actual);
                    for (String column : required) {
                        if (!columns.contains(column)) {
                            violations.add("missing column " + table + "." + column);
                        }
                    }
                    for (Set<String> key : SchemaContract.UNIQUE_KEYS.getOrDefault(table, List.of())) {
                        if (!uniqueIndexes(meta, actual).contains(key)) {
                            violations.add("missing unique key " + table + key);
                        }
                    }
                } catch (SQLException e) {
                    violations.add("cannot inspect " + table + ": " + e.getMessage());
                }
            });

            for (SchemaContract.ForeignKey fk : SchemaContract.FOREIGN_KEYS) {
                String actual = actualTables.get(fk.table());
                if (actual != null && !importedKeys(meta, actual).contains(fk)) {
                    violations.add("missing foreign key " + fk);
                }
            }
        }
        return violations;
    }

    private static Map<String, String> tableNames(DatabaseMetaData meta) throws SQLException {
        Map<String, String> names = new HashMap<>();
        try (ResultSet rs = meta.getTables(null, null, "%", null)) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                names.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
            }
        }
        return names;
    }

    private static Set<String> columnNames(DatabaseMetaData meta, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (ResultSet rs = meta.getColumns(null, null, table, "%")) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }

    private static Set<SchemaContract.ForeignKey> importedKeys(DatabaseMetaData meta, String table)
            throws SQLException {
        Set<SchemaContract.ForeignKey> keys = new HashSet<>();
        try (ResultSet rs = meta.getImportedKeys(null, null, table)) {
            while (rs.next()) {
                keys.add(new SchemaContract.ForeignKey(
                        table.toLowerCase(Locale.ROOT),
                        rs.getString("FKCOLUMN_NAME").toLowerCase(Locale.ROOT),
                        rs.getString("PKTABLE_NAME").toLowerCase(Locale.ROOT),
                        rs.getString("PKCOLUMN_NAME").toLowerCase(Locale.ROOT)));
            }
        }
        return keys;
    }

    private static Set<Set<String>> uniqueIndexes(DatabaseMetaData meta, String table) throws SQLException {
        Map<String, Set<String>> byIndex = new HashMap<>();
        try (ResultSet rs = meta.getIndexInfo(null, null, table, true, false)) {
            while (rs.next()) {
                String index = rs.getString("INDEX_NAME");
                String column = rs.getString("COLUMN_NAME");
                if (index != null && column != null) {
                    byIndex.computeIfAbsent(index, k -> new HashSet<>()).add(column.toLowerCase(Locale.ROOT));
                }
            }
        }
        return new HashSet<>(byIndex.values());
    }
}
