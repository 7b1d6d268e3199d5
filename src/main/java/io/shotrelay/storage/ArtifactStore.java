package io.shotrelay.storage;

import io.shotrelay.config.ShotRelayConfig;
import io.shotrelay.error.NotFoundException;
import io.shotrelay.util.Hashing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Content-addressed blobs (screenshots, logs, capture configs, diff images) keyed by SHA-256.
 * Storing the same bytes twice is a no-op.
 */
public final class ArtifactStore {
    public static final String IMAGE_PNG = "image/png";
    public static final String TEXT_PLAIN = "text/plain";
    public static final String APPLICATION_JSON = "application/json";

    private final ShotRelayConfig config;
    private final Database database;

    public ArtifactStore(ShotRelayConfig config, Database database) {
        this.config = config;
        this.database = database;
    }

    public String store(byte[] content, String contentType) {
        byte[] data = content == null ? new byte[0] : content;
        String sha = Hashing.sha256Hex(data);
        Path target = pathFor(sha);
        try {
            if (!Files.exists(target)) {
                Files.createDirectories(target.getParent());
                writeAtomically(config.scratchDir(), target, data);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write artifact: " + sha, e);
        }
        long now = Instant.now().toEpochMilli();
        database.inTransaction("artifact store", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR IGNORE INTO artifacts(sha256,content_type,size_bytes,created_at_ms) VALUES(?,?,?,?)")) {
                ps.setString(1, sha);
                ps.setString(2, contentType == null ? "application/octet-stream" : contentType);
                ps.setLong(3, data.length);
                ps.setLong(4, now);
                return ps.executeUpdate();
            }
        });
        return sha;
    }

    public String storeText(String text, String contentType) {
        return store(text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8), contentType);
    }

    public boolean exists(String sha) {
        return Hashing.isSha256Hex(sha) && Files.exists(pathFor(sha));
    }

    public byte[] read(String sha) {
        if (!exists(sha)) {
            throw new NotFoundException("Artifact not found: " + sha);
        }
        try {
            return Files.readAllBytes(pathFor(sha));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read artifact: " + sha, e);
        }
    }

    public String readText(String sha) {
        return new String(read(sha), StandardCharsets.UTF_8);
    }

    public Optional<String> contentType(String sha) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT content_type FROM artifacts WHERE sha256=?")) {
            ps.setString(1, sha);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read artifact metadata: " + sha, e);
        }
    }

    /**
     * Writes {@code data} to a temp file under {@code scratchDir} and moves it onto {@code target}.
     * The temp file never outlives the call.
     */
    static void writeAtomically(Path scratchDir, Path target, byte[] data) throws IOException {
        Path tmp = Files.createTempFile(scratchDir, target.getFileName().toString(), ".part");
        try {
            Files.write(tmp, data);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException atomicUnsupported) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public Path pathFor(String sha) {
        if (!Hashing.isSha256Hex(sha)) {
            throw new IllegalArgumentException("Not an artifact hash: " + sha);
        }
        return config.artifactsDir().resolve(sha.substring(0, 2)).resolve(sha);
    }
}
