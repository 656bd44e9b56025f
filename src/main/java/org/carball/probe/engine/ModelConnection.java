package org.carball.probe.engine;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Explicit handle on one engine connection. Every query and profiling component is built
 * per connection and receives this handle; nothing holds connection state globally.
 *
 * <p>The underlying connection is not safe for concurrent query issuance, so callers
 * serialise engine use through {@link #operationLock()}. The {@link #epoch()} increases on
 * every reconnect so dependent state (identifier maps) can detect schema staleness.
 */
@Slf4j
public class ModelConnection implements AutoCloseable {

    private final String connectionString;
    private final ReentrantLock operationLock = new ReentrantLock();
    private final AtomicLong epoch = new AtomicLong();
    private Connection connection;

    public ModelConnection(String connectionString) {
        if (connectionString == null || connectionString.isBlank()) {
            throw new IllegalArgumentException("Connection string must not be empty");
        }
        this.connectionString = connectionString;
    }

    public String getConnectionString() {
        return connectionString;
    }

    /**
     * Returns the open JDBC connection, opening it on first use.
     */
    public synchronized Connection getConnection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            log.debug("Opening engine connection");
            connection = DriverManager.getConnection(connectionString);
        }
        return connection;
    }

    /**
     * Drops the current connection and starts a new epoch. The next query reopens it.
     */
    public synchronized void reconnect() {
        closeQuietly();
        long current = epoch.incrementAndGet();
        log.info("Engine connection reset, epoch {}", current);
    }

    public long epoch() {
        return epoch.get();
    }

    public ReentrantLock operationLock() {
        return operationLock;
    }

    @Override
    public synchronized void close() {
        closeQuietly();
    }

    private void closeQuietly() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Error closing engine connection: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }
}
