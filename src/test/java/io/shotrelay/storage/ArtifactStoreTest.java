package io.shotrelay.storage;

import io.shotrelay.error.NotFoundException;
import io.shotrelay.testing.StoreFixture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class ArtifactStoreTest {

    @Test
    void storingSameBytesTwiceYieldsOneArtifact() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-artifacts-")) {
            ArtifactStore artifacts = f.artifacts();
            byte[] png = "fake-png".getBytes(StandardCharsets.UTF_8);

            String first = artifacts.store(png, ArtifactStore.IMAGE_PNG);
            String second = artifacts.store(png, ArtifactStore.TEXT_PLAIN);

            Assertions.assertEquals(first, second);
            Assertions.assertEquals(64, first.length());
            Assertions.assertTrue(Files.exists(artifacts.pathFor(first)));
            Assertions.assertEquals(first.substring(0, 2), artifacts.pathFor(first).getParent().getFileName().toString());
            Assertions.assertArrayEquals(png, artifacts.read(first));
            Assertions.assertEquals(ArtifactStore.IMAGE_PNG, artifacts.contentType(first).orElseThrow());
        }
    }

    @Test
    void unknownOrMalformedHashesAreNotArtifacts() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-artifacts-missing-")) {
            ArtifactStore artifacts = f.artifacts();
            String missing = "ab".repeat(32);

            Assertions.assertFalse(artifacts.exists(missing));
            Assertions.assertFalse(artifacts.exists("../../etc/passwd"));
            Assertions.assertFalse(artifacts.exists(null));
            Assertions.assertThrows(NotFoundException.class, () -> artifacts.read(missing));
            Assertions.assertTrue(artifacts.contentType(missing).isEmpty());
            Assertions.assertEquals("hello", artifacts.readText(artifacts.storeText("hello", ArtifactStore.TEXT_PLAIN)));
        }
    }

    @Test
    void failedMoveLeavesNoTempFileInScratch() throws Exception {
        try (StoreFixture f = StoreFixture.create("shotrelay-test-artifacts-tmp-")) {
            Path scratch = f.config().scratchDir();
            Path unreachable = f.root().resolve("no-such-dir").resolve("shot.png");

            Assertions.assertThrows(IOException.class, () -> ArtifactStore.writeAtomically(
                    scratch, unreachable, "png".getBytes(StandardCharsets.UTF_8)));

            try (var left = Files.list(scratch)) {
                Assertions.assertEquals(0L, left.count());
            }
            Assertions.assertFalse(Files.exists(unreachable));
        }
    }
}
