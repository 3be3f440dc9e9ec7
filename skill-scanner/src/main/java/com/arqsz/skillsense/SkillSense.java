package com.arqsz.skillsense;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arqsz.skillsense.acquisition.DirectoryArtifactLoader;
import com.arqsz.skillsense.api.AnalysisServer;
import com.arqsz.skillsense.config.ApiKey;
import com.arqsz.skillsense.config.ScannerSettings;
import com.arqsz.skillsense.constants.ServerConstants;
import com.arqsz.skillsense.model.AnalysisReport;
import com.arqsz.skillsense.model.ScannedFile;
import com.arqsz.skillsense.report.ReportJsonMapper;
import com.arqsz.skillsense.scanner.ScoringEngine;
import com.arqsz.skillsense.service.AnalysisFailedException;
import com.arqsz.skillsense.service.AnalysisService;
import com.arqsz.skillsense.util.ContentHasher;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * Command line entry point for SkillSense
 */
public class SkillSense {

    private static final Logger log = LoggerFactory.getLogger(SkillSense.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  skillsense scan <directory> [--validate]   analyze a skill directory and print the result",
            "  skillsense serve                           start the HTTP analysis server",
            "  skillsense keygen <name>                   print a new API key entry for server.api-keys");

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one command
     * 
     * @param args Command line arguments
     * @param out  Stream for command output
     * @param err  Stream for usage and error messages
     * @return Process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        switch (args[0]) {
            case "scan":
                return scan(args, out, err);
            case "serve":
                return serve();
            case "keygen":
                if (args.length != 2) {
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
                out.println(ApiKey.create(args[1]).toEntry());
                return EXIT_OK;
            default:
                err.println("Unknown command: " + args[0]);
                err.println(USAGE);
                return EXIT_USAGE;
        }
    }

    private static int scan(String[] args, PrintStream out, PrintStream err) {
        String directory = null;
        boolean validate = false;
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--validate")) {
                validate = true;
            } else if (directory == null) {
                directory = args[i];
            } else {
                err.println(USAGE);
                return EXIT_USAGE;
            }
        }
        if (directory == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        ScannerSettings settings = ScannerSettings.load();
        List<ScannedFile> files;
        try {
            files = new DirectoryArtifactLoader(settings.getMaxFileBytes()).load(Path.of(directory));
        } catch (IOException e) {
            err.println("Failed to read " + directory + ": " + e.getMessage());
            return EXIT_FAILED;
        }
        log.info("Loaded {} file(s) from {}", files.size(), directory);

        AnalysisReport report;
        try {
            report = AnalysisService.fromSettings(settings).analyze(files, validate);
        } catch (AnalysisFailedException e) {
            JsonObject failure = new JsonObject();
            failure.addProperty(ServerConstants.JSON_KEY_STATUS, ServerConstants.STATUS_FAILED);
            failure.addProperty(ServerConstants.JSON_KEY_ERROR, e.getMessage());
            out.println(GSON.toJson(failure));
            return EXIT_FAILED;
        }

        JsonObject json = ReportJsonMapper.toJson(report);
        json.addProperty(ServerConstants.JSON_KEY_CONTENT_HASH, ContentHasher.hash(files));
        json.addProperty(ServerConstants.JSON_KEY_OVERALL_SCORE, new ScoringEngine().overallScore(report.riskScore()));
        out.println(GSON.toJson(json));
        return EXIT_OK;
    }

    private static int serve() {
        ScannerSettings settings = ScannerSettings.load();
        AnalysisServer server = new AnalysisServer(settings, AnalysisService.fromSettings(settings));
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down SkillSense analysis server...");
            server.stop();
            stopped.countDown();
        }, "skillsense-shutdown"));

        server.start();
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
        }
        return EXIT_OK;
    }
}
