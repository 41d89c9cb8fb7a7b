package com.dynamicpricing.scoring;

import com.dynamicpricing.domain.model.MetricSample;
import com.dynamicpricing.domain.model.ScoringResult;
import com.dynamicpricing.exception.ScoringException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores by spawning the external predictor once per call.
 *
 * <p>The command receives {@code <fuel_price> <congestion_index> <demand_level>} as trailing
 * arguments and prints the multiplier on the first stdout line and the explanation on the
 * second. A non-zero exit, a spawn failure, an unparsable multiplier, or running past
 * {@code processTimeout} raises a {@link ScoringException}.
 *
 * <p>The process is waited for before its output is read; the predictor's two lines fit
 * comfortably in the OS pipe buffer. Whatever the outcome, a process still alive when
 * {@link #score(MetricSample)} returns is destroyed forcibly.
 */
public class SubprocessScorer implements Scorer {

    private static final Logger log = LoggerFactory.getLogger(SubprocessScorer.class);

    private final List<String> command;
    private final File workingDirectory;
    private final Duration processTimeout;

    public SubprocessScorer(List<String> command, File workingDirectory, Duration processTimeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Predictor command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.processTimeout = processTimeout;
    }

    @Override
    public ScoringResult score(MetricSample sample) {
        List<String> args = new ArrayList<>(command);
        args.add(String.format(Locale.ROOT, "%.2f", sample.fuelPrice()));
        args.add(Integer.toString(sample.congestionIndex()));
        args.add(Integer.toString(sample.demandLevel()));

        ProcessBuilder processBuilder = new ProcessBuilder(args);
        if (workingDirectory != null) {
            processBuilder.directory(workingDirectory);
        }

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            throw new ScoringException("Failed to start predictor process: " + e.getMessage(), e);
        }

        try {
            process.getOutputStream().close();

            if (!process.waitFor(processTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ScoringException("Predictor did not finish within " + processTimeout.toMillis() + "ms");
            }

            String stdout = read(process.getInputStream());
            if (process.exitValue() != 0) {
                String stderr = read(process.getErrorStream());
                throw new ScoringException(
                        "Predictor exited with code " + process.exitValue() + ": " + stderr.trim());
            }
            return parse(stdout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScoringException("Predictor call interrupted", e);
        } catch (IOException e) {
            throw new ScoringException("Failed to read predictor output: " + e.getMessage(), e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
                log.debug("Destroyed predictor process pid={}", process.pid());
            }
        }
    }

    @Override
    public String name() {
        return "subprocess";
    }

    static ScoringResult parse(String stdout) {
        String[] lines = stdout.trim().split("\\R");
        double multiplier;
        try {
            multiplier = Double.parseDouble(lines[0].trim());
        } catch (NumberFormatException e) {
            throw new ScoringException("Invalid price multiplier returned from predictor: '" + lines[0] + "'", e);
        }
        if (Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new ScoringException("Invalid price multiplier returned from predictor: " + multiplier);
        }

        String explanation = lines.length > 1 && !lines[1].isBlank() ? lines[1].trim() : ExplanationGenerator.NEUTRAL;
        return ScoringResult.scored(multiplier, explanation);
    }

    private static String read(InputStream stream) throws IOException {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
