package com.vmturbo.postgis.provisioner;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jooq.Query;

/**
 * Executes statements on caller-supplied connections, logging each one with the login it runs
 * as and applying the statement timeout.
 */
public class SqlExecutor {
    private static final Logger logger = LogManager.getLogger();

    private final int queryTimeoutSecs;

    /**
     * Create a new instance.
     *
     * @param statementTimeout timeout applied to every statement; zero for none
     */
    public SqlExecutor(@Nonnull Duration statementTimeout) {
        this.queryTimeoutSecs = (int)Math.min(Integer.MAX_VALUE, statementTimeout.getSeconds());
    }

    /**
     * Log and execute the given SQL statement.
     *
     * @param conn DB connection
     * @param sql  SQL statement to execute
     * @throws SQLException if there's a problem executing the statement
     */
    public void execute(@Nonnull Connection conn, @Nonnull String sql) throws SQLException {
        logger.info("Executing SQL as {}: {}", getConnectionUser(conn), sql);
        try (Statement statement = conn.createStatement()) {
            statement.setQueryTimeout(queryTimeoutSecs);
            statement.execute(sql);
        }
    }

    /**
     * Run a query and report whether it yields any rows.
     *
     * @param conn  DB connection
     * @param query query, possibly with bind values
     * @return true if the query produced at least one row
     * @throws SQLException if the query fails
     */
    public boolean exists(@Nonnull Connection conn, @Nonnull Query query) throws SQLException {
        try (PreparedStatement statement = prepare(conn, query);
             ResultSet rs = statement.executeQuery()) {
            return rs.next();
        }
    }

    /**
     * Run a two-column query and collect its rows into a map, keyed by the first column.
     *
     * @param conn  DB connection
     * @param query query, possibly with bind values
     * @return ordered map of first column to second column
     * @throws SQLException if the query fails
     */
    public Map<String, String> queryPairs(@Nonnull Connection conn, @Nonnull Query query)
            throws SQLException {
        final Map<String, String> result = new LinkedHashMap<>();
        try (PreparedStatement statement = prepare(conn, query);
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                result.put(rs.getString(1), rs.getString(2));
            }
        }
        return result;
    }

    private PreparedStatement prepare(Connection conn, Query query) throws SQLException {
        final String sql = SqlStatements.render(query);
        final List<Object> binds = SqlStatements.bindValues(query);
        logger.debug("Querying as {}: {} {}", getConnectionUser(conn), sql, binds);
        final PreparedStatement statement = conn.prepareStatement(sql);
        try {
            statement.setQueryTimeout(queryTimeoutSecs);
            for (int i = 0; i < binds.size(); i++) {
                statement.setObject(i + 1, binds.get(i));
            }
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
        return statement;
    }

    /**
     * Get the login a connection is authenticated as, for inclusion in log messages.
     *
     * @param conn DB connection
     * @return user name, or null if the driver cannot report it
     */
    @Nullable
    static String getConnectionUser(@Nonnull Connection conn) {
        try {
            return conn.getMetaData().getUserName();
        } catch (SQLException | RuntimeException e) {
            logger.debug("Could not determine connection user", e);
            return null;
        }
    }
}
