package com.typedumper.core.run;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a dump run.
 *
 * @param images images whose artifacts were written completely, in processing order
 * @param failure the failure that ended the run, or null on success
 */
public record RunResult(
    List<ImageOutcome> images,
    Failure failure
) {
    /** Exit code of a successful run. */
    public static final int EXIT_SUCCESS = 0;

    /** Exit code of a failed run. */
    public static final int EXIT_FAILURE = 1;

    /**
     * Compact constructor with validation.
     */
    public RunResult {
        images = images == null ? List.of() : List.copyOf(images);
    }

    static RunResult succeeded(List<ImageOutcome> images) {
        return new RunResult(images, null);
    }

    static RunResult failed(List<ImageOutcome> images, FailureKind kind, String subject, String message) {
        return new RunResult(images, new Failure(kind, subject, message));
    }

    public boolean success() {
        return failure == null;
    }

    /**
     * Returns the process exit code for this result.
     *
     * @return 0 on success, 1 otherwise
     */
    public int exitCode() {
        return success() ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    /**
     * Reason a run stopped.
     *
     * @param kind failure category
     * @param subject path or image the failure is about
     * @param message human-readable description
     */
    public record Failure(
        FailureKind kind,
        String subject,
        String message
    ) {
        public Failure {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /**
     * Artifacts written for one image.
     *
     * @param index discovery index of the image
     * @param imageName image name
     * @param sourcePath source output path
     * @param scriptPath script output path
     */
    public record ImageOutcome(
        int index,
        String imageName,
        String sourcePath,
        String scriptPath
    ) {}
}
