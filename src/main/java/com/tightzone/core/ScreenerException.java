package com.tightzone.core;

/**
 * Terminal failure of a scan, history fetch or request build.
 * The kind tells the caller whether the problem is its own input, the network,
 * the response format or the provider itself.
 */
public class ScreenerException extends RuntimeException {
    private final FailureKind kind;

    public ScreenerException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public ScreenerException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? FailureKind.TRANSPORT : kind;
    }

    public FailureKind kind() {
        return kind;
    }

    public static ScreenerException invalidInput(String message) {
        return new ScreenerException(FailureKind.INVALID_INPUT, message);
    }

    public static ScreenerException transport(String message, Throwable cause) {
        return new ScreenerException(FailureKind.TRANSPORT, message, cause);
    }

    public static ScreenerException decode(String message) {
        return new ScreenerException(FailureKind.DECODE, message);
    }

    public static ScreenerException decode(String message, Throwable cause) {
        return new ScreenerException(FailureKind.DECODE, message, cause);
    }

    public static ScreenerException providerError(String message) {
        return new ScreenerException(FailureKind.PROVIDER_ERROR, message);
    }

    public static ScreenerException cancelled(String message) {
        return new ScreenerException(FailureKind.CANCELLED, message);
    }

    /**
     * One-line form used by the command line front end.
     */
    public String toSingleLine() {
        String msg = getMessage() == null ? "" : getMessage().replace('\n', ' ').replace('\r', ' ').trim();
        return kind.label() + ": " + msg;
    }
}
