package com.typedumper.core.run;

/**
 * Categories of run failures.
 */
public enum FailureKind {
    /** A binary, metadata, toolchain path or toolchain marker file is missing */
    INPUT_NOT_FOUND,

    /** The analyzer produced no images or failed to read the input */
    ANALYSIS_FAILURE,

    /** The configured layout and sort order have no rendering strategy */
    UNSUPPORTED_COMBINATION,

    /** Writing artifacts of an image failed */
    RENDER_FAILURE
}
