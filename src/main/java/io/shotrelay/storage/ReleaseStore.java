package io.shotrelay.storage;

import io.shotrelay.model.BuildView;
import io.shotrelay.model.ReleaseStatus;
import io.shotrelay.model.ReleaseView;
import io.shotrelay.model.RunStatus;
import io.shotrelay.model.RunView;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row access for builds, releases and runs. Every method runs on a caller-supplied connection so
 * the lifecycle manager can compose several reads and writes into one transaction.
 */
public final class ReleaseStore {
    private static final String RELEASE_COLUMNS =
            "id,build_id,name,number,url,status,created_at_ms,updated_at_ms,completed_at_ms";
    private static final String RUN_COLUMNS =
            "id,release_id,name,url,status,image,log,config,diff_image,diff_log,ref_url,ref_image,ref_log,ref_config," +
                    "baseline_pending,created_at_ms,updated_at_ms";

    public long insertBuild(Connection c, String name, boolean isPublic, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO builds(name,is_public,created_at_ms) VALUES(?,?,?)", Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, name);
            ps.setInt(2, isPublic ? 1 : 0);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    public Optional<BuildView> findBuild(Connection c, long buildId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT id,name,is_public,created_at_ms FROM builds WHERE id=?")) {
            ps.setLong(1, buildId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapBuild(rs)) : Optional.empty();
            }
        }
    }

    public Optional<BuildView> findBuildByName(Connection c, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT id,name,is_public,created_at_ms FROM builds WHERE name=?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapBuild(rs)) : Optional.empty();
            }
        }
    }

    public List<BuildView> listBuilds(Connection c) throws SQLException {
        List<BuildView> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT id,name,is_public,created_at_ms FROM builds ORDER BY id ASC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapBuild(rs));
            }
        }
        return out;
    }

    public void updateBuildVisibility(Connection c, long buildId, boolean isPublic) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE builds SET is_public=? WHERE id=?")) {
            ps.setInt(1, isPublic ? 1 : 0);
            ps.setLong(2, buildId);
            ps.executeUpdate();
        }
    }

    public long insertRelease(Connection c, long buildId, String name, int number, String url, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO releases(build_id,name,number,url,status,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, buildId);
            ps.setString(2, name);
            ps.setInt(3, number);
            ps.setString(4, url);
            ps.setString(5, ReleaseStatus.PROCESSING.name());
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    public Optional<ReleaseView> findRelease(Connection c, long releaseId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + RELEASE_COLUMNS + " FROM releases WHERE id=?")) {
            ps.setLong(1, releaseId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRelease(rs)) : Optional.empty();
            }
        }
    }

    public Optional<ReleaseView> findProcessingRelease(Connection c, long buildId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + RELEASE_COLUMNS + " FROM releases WHERE build_id=? AND status=? ORDER BY number DESC, id DESC LIMIT 1")) {
            ps.setLong(1, buildId);
            ps.setString(2, ReleaseStatus.PROCESSING.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRelease(rs)) : Optional.empty();
            }
        }
    }

    /**
     * The baseline release: most recently created GOOD release of the build, newest id on ties.
     */
    public Optional<ReleaseView> findLastGoodRelease(Connection c, long buildId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + RELEASE_COLUMNS + " FROM releases WHERE build_id=? AND status=? ORDER BY created_at_ms DESC, id DESC LIMIT 1")) {
            ps.setLong(1, buildId);
            ps.setString(2, ReleaseStatus.GOOD.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRelease(rs)) : Optional.empty();
            }
        }
    }

    public int maxReleaseNumber(Connection c, long buildId, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COALESCE(MAX(number), 0) FROM releases WHERE build_id=? AND name=?")) {
            ps.setLong(1, buildId);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    public int countReleases(Connection c, long buildId, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM releases WHERE build_id=? AND name=?")) {
            ps.setLong(1, buildId);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    public List<ReleaseView> listReleases(Connection c, long buildId) throws SQLException {
        List<ReleaseView> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + RELEASE_COLUMNS + " FROM releases WHERE build_id=? ORDER BY created_at_ms ASC, id ASC")) {
            ps.setLong(1, buildId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRelease(rs));
                }
            }
        }
        return out;
    }

    /**
     * Moves a release out of {@code from}. Returns false when the row was not in {@code from}.
     */
    public boolean transitionRelease(Connection c, long releaseId, ReleaseStatus from, ReleaseStatus to, long nowMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE releases SET status=?,updated_at_ms=? WHERE id=? AND status=?")) {
            ps.setString(1, to.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, releaseId);
            ps.setString(4, from.name());
            return ps.executeUpdate() > 0;
        }
    }

    public boolean markReleaseCompleted(Connection c, long releaseId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE releases SET completed_at_ms=?,updated_at_ms=? WHERE id=? AND completed_at_ms IS NULL")) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setLong(3, releaseId);
            return ps.executeUpdate() > 0;
        }
    }

    public long insertRun(Connection c, NewRun run, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO runs(release_id,name,url,status,config,ref_url,ref_image,ref_log,ref_config,baseline_pending,created_at_ms,updated_at_ms) " +
                        "VALUES(?,?,?,?,?,?,?,?,?,?,?,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, run.releaseId());
            ps.setString(2, run.name());
            ps.setString(3, run.url());
            ps.setString(4, RunStatus.DATA_PENDING.name());
            ps.setString(5, run.config());
            ps.setString(6, run.refUrl());
            ps.setString(7, run.refImage());
            ps.setString(8, run.refLog());
            ps.setString(9, run.refConfig());
            ps.setInt(10, run.baselinePending() ? 1 : 0);
            ps.setLong(11, nowMs);
            ps.setLong(12, nowMs);
            ps.executeUpdate();
            return generatedId(ps);
        }
    }

    public Optional<RunView> findRun(Connection c, long runId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + RUN_COLUMNS + " FROM runs WHERE id=?")) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRun(rs)) : Optional.empty();
            }
        }
    }

    public Optional<RunView> findRunByName(Connection c, long releaseId, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + RUN_COLUMNS + " FROM runs WHERE release_id=? AND name=?")) {
            ps.setLong(1, releaseId);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRun(rs)) : Optional.empty();
            }
        }
    }

    public List<RunView> listRuns(Connection c, long releaseId) throws SQLException {
        List<RunView> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT " + RUN_COLUMNS + " FROM runs WHERE release_id=? ORDER BY name ASC")) {
            ps.setLong(1, releaseId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRun(rs));
                }
            }
        }
        return out;
    }

    public Map<RunStatus, Integer> countRunsByStatus(Connection c, long releaseId) throws SQLException {
        Map<RunStatus, Integer> out = new EnumMap<>(RunStatus.class);
        for (RunStatus s : RunStatus.values()) {
            out.put(s, 0);
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) FROM runs WHERE release_id=? GROUP BY status")) {
            ps.setLong(1, releaseId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(RunStatus.valueOf(rs.getString(1)), rs.getInt(2));
                }
            }
        }
        return out;
    }

    /**
     * Re-request of an existing run: new url/config, capture results cleared, back to DATA_PENDING.
     * Baseline linkage is left untouched.
     */
    public void resetRunRequest(Connection c, long runId, String url, String config, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE runs SET url=?,config=?,status=?,image=NULL,log=NULL,diff_image=NULL,diff_log=NULL,updated_at_ms=? WHERE id=?")) {
            ps.setString(1, url);
            ps.setString(2, config);
            ps.setString(3, RunStatus.DATA_PENDING.name());
            ps.setLong(4, nowMs);
            ps.setLong(5, runId);
            ps.executeUpdate();
        }
    }

    public void updateRunCapture(Connection c, long runId, String image, String log, String config, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE runs SET image=?,log=?,config=COALESCE(?,config),diff_image=NULL,diff_log=NULL,status=?,updated_at_ms=? WHERE id=?")) {
            ps.setString(1, image);
            ps.setString(2, log);
            ps.setString(3, config);
            ps.setString(4, RunStatus.DATA_PENDING.name());
            ps.setLong(5, nowMs);
            ps.setLong(6, runId);
            ps.executeUpdate();
        }
    }

    /**
     * Fills the baseline of a run created with an explicit override. Only a pending baseline is
     * written, so an established baseline never changes.
     */
    public boolean updateRunBaseline(Connection c, long runId, String refImage, String refLog, String refConfig, long nowMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE runs SET ref_image=?,ref_log=?,ref_config=COALESCE(?,ref_config),baseline_pending=0,updated_at_ms=? " +
                        "WHERE id=? AND baseline_pending=1")) {
            ps.setString(1, refImage);
            ps.setString(2, refLog);
            ps.setString(3, refConfig);
            ps.setLong(4, nowMs);
            ps.setLong(5, runId);
            return ps.executeUpdate() > 0;
        }
    }

    public void updateRunDiff(Connection c, long runId, String diffImage, String diffLog, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE runs SET diff_image=?,diff_log=?,updated_at_ms=? WHERE id=?")) {
            if (diffImage == null) {
                ps.setNull(1, Types.VARCHAR);
            } else {
                ps.setString(1, diffImage);
            }
            ps.setString(2, diffLog);
            ps.setLong(3, nowMs);
            ps.setLong(4, runId);
            ps.executeUpdate();
        }
    }

    public void updateRunStatus(Connection c, long runId, RunStatus status, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE runs SET status=?,updated_at_ms=? WHERE id=?")) {
            ps.setString(1, status.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, runId);
            ps.executeUpdate();
        }
    }

    public void markRunFailed(Connection c, long runId, String log, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE runs SET status=?,log=?,updated_at_ms=? WHERE id=?")) {
            ps.setString(1, RunStatus.FAILED.name());
            ps.setString(2, log);
            ps.setLong(3, nowMs);
            ps.setLong(4, runId);
            ps.executeUpdate();
        }
    }

    private long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }

    private BuildView mapBuild(ResultSet rs) throws SQLException {
        return new BuildView(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getInt("is_public") != 0,
                rs.getLong("created_at_ms")
        );
    }

    private ReleaseView mapRelease(ResultSet rs) throws SQLException {
        long completed = rs.getLong("completed_at_ms");
        Long completedAt = rs.wasNull() ? null : completed;
        return new ReleaseView(
                rs.getLong("id"),
                rs.getLong("build_id"),
                rs.getString("name"),
                rs.getInt("number"),
                rs.getString("url"),
                ReleaseStatus.valueOf(rs.getString("status")),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                completedAt
        );
    }

    private RunView mapRun(ResultSet rs) throws SQLException {
        return new RunView(
                rs.getLong("id"),
                rs.getLong("release_id"),
                rs.getString("name"),
                rs.getString("url"),
                RunStatus.valueOf(rs.getString("status")),
                rs.getString("image"),
                rs.getString("log"),
                rs.getString("config"),
                rs.getString("diff_image"),
                rs.getString("diff_log"),
                rs.getString("ref_url"),
                rs.getString("ref_image"),
                rs.getString("ref_log"),
                rs.getString("ref_config"),
                rs.getInt("baseline_pending") != 0,
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public record NewRun(
            long releaseId,
            String name,
            String url,
            String config,
            String refUrl,
            String refImage,
            String refLog,
            String refConfig,
            boolean baselinePending
    ) {
    }
}
