package io.shotrelay.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shotrelay.error.TransientTaskException;
import io.shotrelay.error.ValidationException;
import io.shotrelay.testing.StoreFixture;
import io.shotrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ProcessEnginesTest {

    @Test
    void captureToolReceivesConfigWithTargetUrl() throws Exception {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        Path scratch = Files.createTempDirectory("shotrelay-test-capture-engine-");
        try {
            // writes the config it was given as the "screenshot"
            ProcessCaptureEngine engine = new ProcessCaptureEngine(
                    List.of("sh", "-c", "cat \"$1\" > \"$2\"; echo rendered", "capture"), 5_000L, scratch);

            CaptureOutput output = engine.capture(new CaptureSpec("https://a.example/", "{\"viewportSize\":{\"width\":800}}"));

            JsonNode written = Jsons.parse(new String(output.image(), StandardCharsets.UTF_8));
            Assertions.assertEquals("https://a.example/", written.path("targetUrl").asText());
            Assertions.assertEquals(800, written.path("viewportSize").path("width").asInt());
            Assertions.assertEquals("rendered", output.log().trim());
            try (var left = Files.list(scratch)) {
                Assertions.assertEquals(0L, left.count());
            }
        } finally {
            StoreFixture.deleteRecursively(scratch);
        }
    }

    @Test
    void captureToolFailuresAreTransient() throws Exception {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        Path scratch = Files.createTempDirectory("shotrelay-test-capture-fail-");
        try {
            CaptureSpec spec = new CaptureSpec("https://a.example/", "{}");
            ProcessCaptureEngine crashing = new ProcessCaptureEngine(
                    List.of("sh", "-c", "echo 'page crashed'; exit 3", "capture"), 5_000L, scratch);
            ProcessCaptureEngine silent = new ProcessCaptureEngine(List.of("sh", "-c", "exit 0", "capture"), 5_000L, scratch);
            ProcessCaptureEngine hanging = new ProcessCaptureEngine(List.of("sh", "-c", "sleep 10", "capture"), 1_000L, scratch);
            ProcessCaptureEngine missing = new ProcessCaptureEngine(List.of("/nonexistent/phantomjs"), 5_000L, scratch);

            TransientTaskException crash = Assertions.assertThrows(TransientTaskException.class, () -> crashing.capture(spec));
            Assertions.assertTrue(crash.getMessage().contains("exit=3"));
            Assertions.assertTrue(crash.getMessage().contains("page crashed"));
            Assertions.assertThrows(TransientTaskException.class, () -> silent.capture(spec));
            Assertions.assertThrows(TransientTaskException.class, () -> hanging.capture(spec));
            Assertions.assertThrows(TransientTaskException.class, () -> missing.capture(spec));
        } finally {
            StoreFixture.deleteRecursively(scratch);
        }
    }

    @Test
    void captureConfigMustBeAnObject() {
        Assertions.assertThrows(ValidationException.class,
                () -> ProcessCaptureEngine.captureConfig(new CaptureSpec("https://a.example/", "[1,2]")));
        ObjectNode config = ProcessCaptureEngine.captureConfig(new CaptureSpec("https://a.example/", "{\"targetUrl\":\"old\"}"));
        Assertions.assertEquals("https://a.example/", config.path("targetUrl").asText());
    }

    @Test
    void diffToolExitCodesMapToOutcomes() throws Exception {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        Path scratch = Files.createTempDirectory("shotrelay-test-diff-engine-");
        try {
            // positional args: $8 before, $9 after, ${10} diff output
            String script = "if cmp -s \"$8\" \"$9\"; then echo '0 (0)'; exit 0; fi; "
                    + "printf diff > \"${10}\"; echo '42 (0.1)'; exit 1";
            ProcessDiffEngine engine = new ProcessDiffEngine(List.of("sh", "-c", script, "compare"), 5_000L, scratch);
            byte[] a = "a".getBytes(StandardCharsets.UTF_8);
            byte[] b = "b".getBytes(StandardCharsets.UTF_8);

            DiffOutput same = engine.diff(a, a);
            DiffOutput changed = engine.diff(a, b);

            Assertions.assertTrue(same.identical());
            Assertions.assertFalse(changed.identical());
            Assertions.assertEquals("diff", new String(changed.diffImage(), StandardCharsets.UTF_8));
            Assertions.assertEquals("42 (0.1)", changed.log().trim());

            ProcessDiffEngine broken = new ProcessDiffEngine(
                    List.of("sh", "-c", "echo 'unable to open image'; exit 2", "compare"), 5_000L, scratch);
            Assertions.assertThrows(TransientTaskException.class, () -> broken.diff(a, b));
        } finally {
            StoreFixture.deleteRecursively(scratch);
        }
    }
}
