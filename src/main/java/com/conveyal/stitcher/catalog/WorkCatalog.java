package com.conveyal.stitcher.catalog;

import com.conveyal.stitcher.components.Component;
import com.conveyal.stitcher.models.StitchJob;
import com.conveyal.stitcher.models.WorkItem;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The durable record of every unit of work: one row per (scenario, raster, grid cell) with a flag saying whether the
 * cell has been stitched. This is an SQLite database file in the workspace directory.
 *
 * The table is written in bulk once when the catalog is initialized, and afterward the only writes are single-row
 * updates of the stitched flag when workers report completion. The dispatcher reads the backlog through a separate
 * read-only connection. The database is in WAL journal mode so that read does not block those writes.
 */
public class WorkCatalog implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(WorkCatalog.class);

    public interface Config {
        String workspaceDirectory ();
        double gridStepDegrees ();
        List<String> scenarioIds ();
        List<String> rasterIds ();
    }

    public static final String DATABASE_FILE_NAME = "status_database.sqlite3";
    public static final String TABLE_NAME = "job_status";

    /** How many rows to insert at a time in a batch, for efficiency. */
    private static final int INSERT_BATCH_SIZE = 10_000;

    /** How long a connection waits on a lock held by another connection before failing. */
    private static final int BUSY_TIMEOUT_MSEC = 10_000;

    private final Config config;
    private final File databaseFile;

    /**
     * Written with a timestamp only after all rows are committed. A database without this token was interrupted
     * part-way through initialization and can't be trusted.
     */
    private final File tokenFile;
    private final String jdbcUrl;

    public WorkCatalog (Config config) {
        this.config = config;
        File workspace = new File(config.workspaceDirectory());
        this.databaseFile = new File(workspace, DATABASE_FILE_NAME);
        this.tokenFile = new File(workspace, DATABASE_FILE_NAME + ".CREATED");
        this.jdbcUrl = "jdbc:sqlite:" + databaseFile.getAbsolutePath();
    }

    /**
     * Initialize the catalog unless a complete one already exists in the workspace, so that restarting the
     * coordinator keeps the record of which cells are already stitched.
     * @return true if the catalog was (re)created, false if the existing one was kept.
     */
    public synchronized boolean initializeIfNeeded () {
        if (databaseFile.exists() && tokenFile.exists()) {
            LOG.info("Keeping existing work catalog {} created {}.", databaseFile, readToken());
            return false;
        }
        initialize();
        return true;
    }

    /**
     * Drop and recreate the catalog table, then insert one unstitched row for every combination of scenario, raster
     * and grid cell. Any progress recorded in an existing table is lost.
     */
    public synchronized void initialize () {
        List<Envelope> cells;
        try {
            cells = GlobalGrid.cells(config.gridStepDegrees());
        } catch (IllegalArgumentException e) {
            throw new CatalogException("Cannot tile the globe for the work catalog.", e);
        }
        try {
            Files.createDirectories(databaseFile.getParentFile().toPath());
            Files.deleteIfExists(tokenFile.toPath());
        } catch (IOException e) {
            throw new CatalogException("Could not prepare workspace directory for the work catalog.", e);
        }
        int nRows = 0;
        try (Connection connection = openConnection(false)) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.execute(String.format("drop table if exists %s", TABLE_NAME));
                statement.execute(String.format("create table %s (scenario_id text not null, " +
                        "raster_id text not null, lng_min float not null, lat_min float not null, " +
                        "lng_max float not null, lat_max float not null, stitched int not null)", TABLE_NAME));
                statement.execute(String.format("create index %s_cell on %s " +
                        "(scenario_id, raster_id, lng_min, lat_min)", TABLE_NAME, TABLE_NAME));
            }
            String insertSql = String.format("insert into %s (scenario_id, raster_id, lng_min, lat_min, " +
                    "lng_max, lat_max, stitched) values (?, ?, ?, ?, ?, ?, 0)", TABLE_NAME);
            try (PreparedStatement insert = connection.prepareStatement(insertSql)) {
                for (String scenarioId : config.scenarioIds()) {
                    for (String rasterId : config.rasterIds()) {
                        for (Envelope cell : cells) {
                            insert.setString(1, scenarioId);
                            insert.setString(2, rasterId);
                            insert.setDouble(3, cell.getMinX());
                            insert.setDouble(4, cell.getMinY());
                            insert.setDouble(5, cell.getMaxX());
                            insert.setDouble(6, cell.getMaxY());
                            insert.addBatch();
                            nRows += 1;
                            if (nRows % INSERT_BATCH_SIZE == 0) {
                                insert.executeBatch();
                            }
                        }
                    }
                }
                insert.executeBatch();
            }
            connection.commit();
        } catch (SQLException e) {
            throw new CatalogException("Could not create work catalog " + databaseFile, e);
        }
        writeToken();
        LOG.info("Created work catalog {} with {} items ({} cells of {} degrees).",
                databaseFile, nRows, cells.size(), config.gridStepDegrees());
    }

    /**
     * Snapshot of every item that is not yet stitched, read through a read-only connection. The rows are all read
     * before returning so the connection is not held open while the caller dispatches them.
     */
    public List<WorkItem> readBacklog () {
        String sql = String.format("select scenario_id, raster_id, lng_min, lat_min, lng_max, lat_max " +
                "from %s where stitched = 0", TABLE_NAME);
        List<WorkItem> backlog = new ArrayList<>();
        try (Connection connection = openConnection(true);
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            while (resultSet.next()) {
                Envelope cell = new Envelope(
                        resultSet.getDouble(3), resultSet.getDouble(5),
                        resultSet.getDouble(4), resultSet.getDouble(6)
                );
                backlog.add(new WorkItem(resultSet.getString(1), resultSet.getString(2), cell, false));
            }
        } catch (SQLException e) {
            throw new CatalogException("Could not read backlog from work catalog " + databaseFile, e);
        }
        LOG.info("Read {} unstitched items from the work catalog.", backlog.size());
        return backlog;
    }

    /**
     * Record that the given job has been completed by a worker.
     * @return true if a matching unstitched row was found and updated.
     */
    public boolean markStitched (StitchJob job) {
        String sql = String.format("update %s set stitched = 1 where scenario_id = ? and raster_id = ? " +
                "and lng_min = ? and lat_min = ? and lng_max = ? and lat_max = ? and stitched = 0", TABLE_NAME);
        try (Connection connection = openConnection(false);
             PreparedStatement update = connection.prepareStatement(sql)) {
            update.setString(1, job.scenarioId);
            update.setString(2, job.rasterId);
            update.setDouble(3, job.lngMin);
            update.setDouble(4, job.latMin);
            update.setDouble(5, job.lngMax);
            update.setDouble(6, job.latMax);
            int nUpdated = update.executeUpdate();
            if (nUpdated == 0) {
                LOG.warn("No unstitched catalog item matches {}, it may have been completed twice.", job);
            }
            return nUpdated > 0;
        } catch (SQLException e) {
            throw new CatalogException("Could not mark " + job + " as stitched.", e);
        }
    }

    /** Total and stitched item counts, for status reporting. */
    public Counts countItems () {
        String sql = String.format("select count(*), coalesce(sum(stitched), 0) from %s", TABLE_NAME);
        try (Connection connection = openConnection(true);
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            resultSet.next();
            return new Counts(resultSet.getInt(1), resultSet.getInt(2));
        } catch (SQLException e) {
            throw new CatalogException("Could not count items in work catalog " + databaseFile, e);
        }
    }

    private Connection openConnection (boolean readOnly) throws SQLException {
        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setBusyTimeout(BUSY_TIMEOUT_MSEC);
        if (readOnly) {
            sqliteConfig.setReadOnly(true);
        } else {
            // WAL mode is persistent in the database file, so read-only connections pick it up without setting it.
            sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        }
        return DriverManager.getConnection(jdbcUrl, sqliteConfig.toProperties());
    }

    private void writeToken () {
        try {
            Files.write(tokenFile.toPath(), Instant.now().toString().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CatalogException("Could not write work catalog creation token " + tokenFile, e);
        }
    }

    private String readToken () {
        try {
            return new String(Files.readAllBytes(tokenFile.toPath()), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            LOG.warn("Could not read work catalog creation token {}: {}", tokenFile, e.toString());
            return "at an unknown time";
        }
    }

    /** Item counts in the catalog. Public final fields so it can be serialized into status responses. */
    public static class Counts {
        public final int total;
        public final int stitched;

        public Counts (int total, int stitched) {
            this.total = total;
            this.stitched = stitched;
        }
    }

}
