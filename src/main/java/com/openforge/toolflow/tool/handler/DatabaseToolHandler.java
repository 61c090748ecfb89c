package com.openforge.toolflow.tool.handler;

import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolExecutionException;
import com.openforge.toolflow.tool.ToolProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handler for {@code database} tools.
 *
 * One connection per call: acquired from the URL given by the call (parameter
 * {@code database_url}) or the tool config ({@code url}), otherwise from the
 * application's shared DataSource, and closed before returning.  The statement
 * runs as a PreparedStatement with optional positional {@code params}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseToolHandler {

    private final ObjectProvider<DataSource> dataSource;
    private final ToolProperties properties;

    public Map<String, Object> execute(ToolDescriptor tool, Map<String, Object> parameters) {
        String query = Values.string(parameters.get("query"));
        if (query == null) {
            throw new ToolExecutionException("Query is required for database tools");
        }
        List<Object> params = parameters.get("params") instanceof List<?> list
                ? new ArrayList<>(list)
                : List.of();
        int maxRows = (int) Values.longValue(tool.config().get("max_rows"), properties.database().maxRows());

        try (Connection connection = connect(tool, parameters);
             PreparedStatement statement = connection.prepareStatement(query)) {
            statement.setMaxRows(maxRows);
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }

            Map<String, Object> result = new LinkedHashMap<>();
            if (statement.execute()) {
                List<Map<String, Object>> rows = readRows(statement.getResultSet());
                result.put("data", rows);
                result.put("row_count", rows.size());
            } else {
                result.put("data", Map.of("affected_rows", statement.getUpdateCount()));
            }
            log.debug("[DatabaseTool:{}] Executed statement, result keys {}", tool.name(), result.keySet());
            return result;
        } catch (SQLException e) {
            throw new ToolExecutionException("Database execution failed: " + e.getMessage(), e);
        }
    }

    // ── Connection ───────────────────────────────────────────────────────────

    private Connection connect(ToolDescriptor tool, Map<String, Object> parameters) throws SQLException {
        String url = Values.firstNonBlank(
                Values.string(parameters.get("database_url")),
                Values.string(tool.config().get("url")));
        if (url != null) {
            JdbcTarget target;
            try {
                target = JdbcTarget.parse(url,
                        Values.string(tool.config().get("username")),
                        Values.string(tool.config().get("password")));
            } catch (IllegalArgumentException e) {
                throw new ToolExecutionException(e.getMessage(), e);
            }
            return target.username() == null
                    ? DriverManager.getConnection(target.jdbcUrl())
                    : DriverManager.getConnection(target.jdbcUrl(), target.username(), target.password());
        }

        DataSource shared = dataSource.getIfAvailable();
        if (shared == null) {
            throw new ToolExecutionException("Database URL not configured");
        }
        return shared.getConnection();
    }

    private static List<Map<String, Object>> readRows(ResultSet resultSet) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (ResultSet rs = resultSet) {
            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int c = 1; c <= columns; c++) {
                    row.put(meta.getColumnLabel(c), rs.getObject(c));
                }
                rows.add(row);
            }
        }
        return rows;
    }
}
