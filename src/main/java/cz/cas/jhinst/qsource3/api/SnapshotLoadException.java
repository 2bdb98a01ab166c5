package cz.cas.jhinst.qsource3.api;

import java.util.Optional;

/**
 * Indicates that a persisted settings file could not be applied.
 * <p>
 * Whatever the cause, the settings mirror is left exactly as it was before the
 * load was attempted.
 * <p>
 * This typically reflects:
 * <ul>
 *   <li>An unreadable file or undecodable content</li>
 *   <li>A missing settings key</li>
 *   <li>A value that failed validation, available via {@link #failure()}</li>
 * </ul>
 */
public final class SnapshotLoadException extends Exception
{
    private final transient ValidationFailure failure;

    public SnapshotLoadException(String message) {
        super(message);
        this.failure = null;
    }

    public SnapshotLoadException(String message, Throwable cause) {
        super(message, cause);
        this.failure = null;
    }

    public SnapshotLoadException(ValidationFailure failure) {
        super("Invalid settings snapshot: " + failure);
        this.failure = failure;
    }

    public Optional<ValidationFailure> failure() {
        return Optional.ofNullable(failure);
    }
}
