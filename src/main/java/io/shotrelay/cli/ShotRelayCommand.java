package io.shotrelay.cli;

import io.shotrelay.config.ShotRelayConfig;
import io.shotrelay.error.ValidationException;
import io.shotrelay.lifecycle.ReleaseLifecycleManager;
import io.shotrelay.model.BuildView;
import io.shotrelay.model.CrawlRequest;
import io.shotrelay.model.ReleaseView;
import io.shotrelay.model.RunView;
import io.shotrelay.runtime.ShotRelayRuntime;
import io.shotrelay.storage.ArtifactStore;
import io.shotrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "shotrelay",
        mixinStandardHelpOptions = true,
        description = "Screenshot capture and perceptual diff tracking for release candidates",
        subcommands = {
                ShotRelayCommand.InitCommand.class,
                ShotRelayCommand.CreateBuildCommand.class,
                ShotRelayCommand.BuildVisibilityCommand.class,
                ShotRelayCommand.BuildsCommand.class,
                ShotRelayCommand.CreateCandidateCommand.class,
                ShotRelayCommand.CreateRunCommand.class,
                ShotRelayCommand.UploadCaptureCommand.class,
                ShotRelayCommand.ApproveRunCommand.class,
                ShotRelayCommand.FailRunCommand.class,
                ShotRelayCommand.MarkCompleteCommand.class,
                ShotRelayCommand.PromoteCommand.class,
                ShotRelayCommand.RejectCommand.class,
                ShotRelayCommand.ReleaseCommand.class,
                ShotRelayCommand.RunsCommand.class,
                ShotRelayCommand.TasksCommand.class,
                ShotRelayCommand.CrawlCommand.class,
                ShotRelayCommand.WorkerCommand.class
        }
)
public final class ShotRelayCommand implements Runnable {

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = ShotRelayConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create-build | build-visibility | builds | create-candidate | create-run | "
                + "upload-capture | approve-run | fail-run | mark-complete | promote | reject | release | runs | tasks | crawl | worker");
    }

    ShotRelayRuntime runtime() {
        ShotRelayRuntime runtime = new ShotRelayRuntime(ShotRelayConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Override
        public Integer call() {
            ShotRelayRuntime runtime = parent.runtime();
            System.out.println("Initialized shotrelay at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "create-build", description = "Create a build (a product or site tracked over time)")
    static final class CreateBuildCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--name"}, required = true, description = "Unique build name")
        String name;

        @Option(names = {"--public"}, defaultValue = "false", description = "Make the build publicly visible")
        boolean isPublic;

        @Override
        public Integer call() {
            BuildView build = parent.runtime().lifecycle().createBuild(name, isPublic);
            System.out.println(Jsons.toJson(build));
            return 0;
        }
    }

    @Command(name = "build-visibility", description = "Change whether a build is public")
    static final class BuildVisibilityCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--build"}, required = true, description = "Build id")
        long buildId;

        @Option(names = {"--public"}, required = true, arity = "1", description = "true|false")
        boolean isPublic;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lifecycle().setBuildVisibility(buildId, isPublic)));
            return 0;
        }
    }

    @Command(name = "builds", description = "List builds")
    static final class BuildsCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lifecycle().builds()));
            return 0;
        }
    }

    @Command(name = "create-candidate", description = "Open a new release candidate, superseding the active one")
    static final class CreateCandidateCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--build"}, required = true, description = "Build id")
        long buildId;

        @Option(names = {"--name"}, required = true, description = "Release name")
        String name;

        @Option(names = {"--url"}, description = "Release landing URL")
        String url;

        @Override
        public Integer call() {
            ReleaseView release = parent.runtime().lifecycle().createCandidate(buildId, name, url);
            System.out.println(Jsons.toJson(release));
            return 0;
        }
    }

    @Command(name = "create-run", description = "Request a capture for a named run of a candidate")
    static final class CreateRunCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--release"}, required = true, description = "Release id")
        long releaseId;

        @Option(names = {"--name"}, required = true, description = "Run name, e.g. the page path")
        String name;

        @Option(names = {"--url"}, required = true, description = "URL to capture")
        String url;

        @Option(names = {"--config"}, defaultValue = "{}", description = "Capture config JSON")
        String config;

        @Option(names = {"--ref-url"}, description = "Explicit baseline URL (requires --ref-config)")
        String refUrl;

        @Option(names = {"--ref-config"}, description = "Explicit baseline capture config JSON (requires --ref-url)")
        String refConfig;

        @Override
        public Integer call() {
            RunView run = parent.runtime().lifecycle().createOrUpdateRun(releaseId, name, url, config, refUrl, refConfig);
            System.out.println(Jsons.toJson(run));
            return 0;
        }
    }

    @Command(name = "upload-capture", description = "Record a screenshot taken outside the worker pool")
    static final class UploadCaptureCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--run"}, required = true, description = "Run id")
        long runId;

        @Option(names = {"--image"}, required = true, description = "PNG file")
        Path image;

        @Option(names = {"--log"}, description = "Capture log file")
        Path log;

        @Override
        public Integer call() throws Exception {
            ShotRelayRuntime runtime = parent.runtime();
            ArtifactStore artifacts = runtime.artifacts();
            String imageSha = artifacts.store(Files.readAllBytes(image), ArtifactStore.IMAGE_PNG);
            String logSha = log == null ? null : artifacts.store(Files.readAllBytes(log), ArtifactStore.TEXT_PLAIN);
            RunView run = runtime.lifecycle().recordCapture(runId, imageSha, logSha, null);
            System.out.println(Jsons.toJson(run));
            return 0;
        }
    }

    @Command(name = "approve-run", description = "Accept the difference of a DIFF_NEEDED run")
    static final class ApproveRunCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--run"}, required = true, description = "Run id")
        long runId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lifecycle().approveRun(runId)));
            return 0;
        }
    }

    @Command(name = "fail-run", description = "Mark a run FAILED with a log explaining why")
    static final class FailRunCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--run"}, required = true, description = "Run id")
        long runId;

        @Option(names = {"--log"}, description = "Failure log text")
        String logText;

        @Option(names = {"--log-file"}, description = "Failure log file")
        Path logFile;

        @Override
        public Integer call() throws Exception {
            String text = logFile != null ? Files.readString(logFile, StandardCharsets.UTF_8) : logText;
            if (text == null || text.isBlank()) {
                throw new ValidationException("A failure log is required (--log or --log-file)");
            }
            ShotRelayRuntime runtime = parent.runtime();
            String logSha = runtime.artifacts().storeText(text, ArtifactStore.TEXT_PLAIN);
            System.out.println(Jsons.toJson(runtime.lifecycle().markRunFailed(runId, logSha)));
            return 0;
        }
    }

    @Command(name = "mark-complete", description = "Declare a candidate's run set final")
    static final class MarkCompleteCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--release"}, required = true, description = "Release id")
        long releaseId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lifecycle().markComplete(releaseId)));
            return 0;
        }
    }

    @Command(name = "promote", description = "Mark a candidate GOOD")
    static final class PromoteCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--release"}, required = true, description = "Release id")
        long releaseId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lifecycle().promote(releaseId)));
            return 0;
        }
    }

    @Command(name = "reject", description = "Mark a candidate BAD")
    static final class RejectCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--release"}, required = true, description = "Release id")
        long releaseId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lifecycle().reject(releaseId)));
            return 0;
        }
    }

    @Command(name = "release", description = "Show a release with its runs")
    static final class ReleaseCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--release"}, required = true, description = "Release id")
        long releaseId;

        @Override
        public Integer call() {
            ReleaseLifecycleManager lifecycle = parent.runtime().lifecycle();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("release", lifecycle.release(releaseId).orElse(null));
            out.put("runs", lifecycle.runs(releaseId));
            System.out.println(Jsons.toPrettyJson(out));
            return out.get("release") == null ? 1 : 0;
        }
    }

    @Command(name = "runs", description = "List runs of a release")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--release"}, required = true, description = "Release id")
        long releaseId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lifecycle().runs(releaseId)));
            return 0;
        }
    }

    @Command(name = "tasks", description = "List capture/diff tasks of a release, or task counts")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--release"}, description = "Release id; omit for counts by status")
        Long releaseId;

        @Override
        public Integer call() {
            ShotRelayRuntime runtime = parent.runtime();
            Object out = releaseId == null ? runtime.tasks().countByStatus() : runtime.tasks().listByOwner(releaseId);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "crawl", description = "Crawl a site into a candidate and process captures and diffs until idle")
    static final class CrawlCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--build"}, required = true, description = "Build id")
        long buildId;

        @Option(names = {"--url"}, required = true, description = "Root URL to crawl")
        String url;

        @Option(names = {"--release-name"}, description = "Release name; defaults to a timestamp")
        String releaseName;

        @Option(names = {"--depth"}, description = "Link depth; defaults to the crawlDepth setting")
        Integer depth;

        @Option(names = {"--ignore"}, split = ",", description = "URL prefixes to skip")
        List<String> ignore;

        @Option(names = {"--config"}, defaultValue = "{}", description = "Capture config JSON for every page")
        String config;

        @Option(names = {"--wait-ms"}, defaultValue = "600000", description = "Max time to wait for captures and diffs")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            try (ShotRelayRuntime runtime = parent.runtime()) {
                runtime.start();
                int effectiveDepth = depth == null ? runtime.settings().crawlDepth() : depth;
                runtime.submitCrawl(new CrawlRequest(buildId, url, releaseName, effectiveDepth, ignore, config));
                boolean idle = runtime.awaitQuiescent(Duration.ofMillis(waitMs));
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("idle", idle);
                out.put("activeCandidate", runtime.lifecycle().activeCandidate(buildId).orElse(null));
                out.put("coordinator", runtime.coordinator().snapshot());
                out.put("tasks", runtime.tasks().countByStatus());
                System.out.println(Jsons.toJson(out));
                return idle ? 0 : 3;
            }
        }
    }

    @Command(name = "worker", description = "Run the worker pool until interrupted")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        ShotRelayCommand parent;

        @Option(names = {"--until-idle"}, defaultValue = "false", description = "Exit once no task is queued or leased")
        boolean untilIdle;

        @Option(names = {"--wait-ms"}, defaultValue = "600000", description = "Max wait with --until-idle")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            ShotRelayRuntime runtime = parent.runtime();
            runtime.start();
            if (untilIdle) {
                boolean idle = runtime.awaitQuiescent(Duration.ofMillis(waitMs));
                System.out.println(Jsons.toJson(runtime.stop()));
                return idle ? 0 : 3;
            }
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                System.out.println(Jsons.toJson(runtime.stop()));
                stopped.countDown();
            }, "shotrelay-shutdown-hook"));
            stopped.await();
            return 0;
        }
    }
}
