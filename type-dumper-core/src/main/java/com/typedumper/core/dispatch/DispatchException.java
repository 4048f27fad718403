package com.typedumper.core.dispatch;

/**
 * Thrown when the source output of an image cannot be produced.
 */
public class DispatchException extends Exception {

    /**
     * Failure category.
     */
    public enum Reason {
        /** The layout/sort combination has no rendering strategy */
        UNSUPPORTED_COMBINATION,

        /** The renderer failed while writing artifacts */
        RENDER_FAILURE
    }

    private final Reason reason;

    public DispatchException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DispatchException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    static DispatchException unsupported(LayoutSchema layout, SortOrder sort, String detail) {
        return new DispatchException(Reason.UNSUPPORTED_COMBINATION,
            "Unsupported layout/sort combination (" + layout + ", " + sort + "): " + detail);
    }
}
