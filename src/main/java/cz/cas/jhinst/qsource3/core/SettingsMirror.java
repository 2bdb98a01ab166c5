package cz.cas.jhinst.qsource3.core;

import cz.cas.jhinst.qsource3.api.SettingChange;
import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.SettingsListener;
import cz.cas.jhinst.qsource3.api.SettingsSnapshot;
import cz.cas.jhinst.qsource3.api.UpdateOrigin;
import cz.cas.jhinst.qsource3.api.ValidationFailure;
import cz.cas.jhinst.qsource3.validation.SettingValidator;
import cz.cas.jhinst.qsource3.validation.ValidationResult;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SettingsMirror
 * -----------------------------------------------------------------------------
 * The local, authoritative copy of the device's seven settings.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Holds exactly one canonical value per {@link SettingField}</li>
 *   <li>Runs every candidate through {@link SettingValidator} before mutating</li>
 *   <li>Raises one {@link SettingChange} per successful mutation, including
 *       mutations that store the value already held</li>
 * </ul>
 *
 * It knows nothing about the transport or the front-end.
 *
 * <h2>Invariant</h2>
 * <blockquote>
 *     Each field holds the last value that passed validation. An invalid
 *     candidate never mutates the mirror.
 * </blockquote>
 *
 * <h2>Threading model</h2>
 * Each field has its own lock. A single-field update holds only that field's
 * lock, so the operator path and the device path serialize per field with
 * last-writer-wins. {@link #replaceAll(Map, UpdateOrigin)} and
 * {@link #snapshot()} take all seven locks, always in declaration order.
 * <p>
 * Notifications are queued while the field lock is held and delivered after
 * it is released, by whichever thread is currently draining the queue. Per
 * field, listeners therefore observe changes in exactly the order they were
 * applied, and no listener code ever runs under a field lock.
 */
public final class SettingsMirror
{
    private final ReentrantLock[] locks = new ReentrantLock[SettingField.values().length];
    private final Object[] values = new Object[SettingField.values().length];

    private final SettingsListener listener;

    private final Queue<SettingChange> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean delivering = new AtomicBoolean(false);

    public SettingsMirror(SettingsListener listener) {
        this(SettingsSnapshot.defaults(), listener);
    }

    public SettingsMirror(SettingsSnapshot initial, SettingsListener listener) {
        Objects.requireNonNull(initial, "initial");
        this.listener = Objects.requireNonNull(listener, "listener");

        for (SettingField field : SettingField.values()) {
            locks[field.ordinal()] = new ReentrantLock();
            values[field.ordinal()] = initial.get(field);
        }
    }

    public Object get(SettingField field) {
        Objects.requireNonNull(field, "field");
        ReentrantLock lock = locks[field.ordinal()];
        lock.lock();
        try {
            return values[field.ordinal()];
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of all seven fields taken under all seven locks.
     */
    public SettingsSnapshot snapshot() {
        Map<SettingField, Object> copy = new EnumMap<>(SettingField.class);
        lockAll();
        try {
            for (SettingField field : SettingField.values()) {
                copy.put(field, values[field.ordinal()]);
            }
        } finally {
            unlockAll();
        }
        return SettingsSnapshot.fromMap(copy);
    }

    /**
     * Validates {@code candidate} and, if it passes, stores the normalized
     * value and notifies listeners.
     *
     * @return the validation outcome; on {@link ValidationResult.Valid} the
     *         carried value is what was stored
     */
    public ValidationResult setIfValid(SettingField field, Object candidate, UpdateOrigin origin) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(origin, "origin");

        ValidationResult result = SettingValidator.validate(field, candidate);
        if (!(result instanceof ValidationResult.Valid valid)) {
            return result;
        }

        ReentrantLock lock = locks[field.ordinal()];
        lock.lock();
        try {
            values[field.ordinal()] = valid.value();
            pending.add(new SettingChange(field, valid.value(), origin));
        } finally {
            lock.unlock();
        }

        deliverPending();
        return result;
    }

    /**
     * Replaces all seven fields, all or nothing.
     * <p>
     * Every candidate is validated before any lock is taken. If one field is
     * missing or invalid the mirror is left untouched and no notification is
     * raised. Otherwise all fields are written while all locks are held and one
     * notification per field is raised, in declaration order.
     *
     * @return the first failure, or empty if the replacement was applied
     */
    public Optional<ValidationFailure> replaceAll(Map<SettingField, ?> candidate, UpdateOrigin origin) {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(origin, "origin");

        Object[] normalized = new Object[values.length];
        for (SettingField field : SettingField.values()) {
            ValidationResult result = SettingValidator.validate(field, candidate.get(field));
            if (result instanceof ValidationResult.Invalid invalid) {
                return Optional.of(invalid.failure());
            }
            normalized[field.ordinal()] = ((ValidationResult.Valid) result).value();
        }

        lockAll();
        try {
            for (SettingField field : SettingField.values()) {
                values[field.ordinal()] = normalized[field.ordinal()];
                pending.add(new SettingChange(field, normalized[field.ordinal()], origin));
            }
        } finally {
            unlockAll();
        }

        deliverPending();
        return Optional.empty();
    }

    public Optional<ValidationFailure> replaceAll(SettingsSnapshot snapshot, UpdateOrigin origin) {
        Objects.requireNonNull(snapshot, "snapshot");
        return replaceAll(snapshot.asMap(), origin);
    }

    // ------------------------
    // Locking and delivery
    // ------------------------

    private void lockAll() {
        for (ReentrantLock lock : locks) {
            lock.lock();
        }
    }

    private void unlockAll() {
        for (int i = locks.length - 1; i >= 0; i--) {
            locks[i].unlock();
        }
    }

    /**
     * Drains queued notifications unless another thread is already doing so.
     * A change queued while another thread drains is picked up by that thread
     * before it gives up the delivery role.
     */
    private void deliverPending() {
        while (delivering.compareAndSet(false, true)) {
            try {
                SettingChange change;
                while ((change = pending.poll()) != null) {
                    listener.onSettingChanged(change);
                }
            } finally {
                delivering.set(false);
            }
            if (pending.isEmpty()) {
                return;
            }
        }
    }
}
