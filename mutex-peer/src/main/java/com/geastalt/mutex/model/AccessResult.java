/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.mutex.model;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Result of a mutual exclusion operation: either a value or an {@link AccessError}.
 */
public sealed interface AccessResult<T> permits AccessResult.Success, AccessResult.Failure {

    static <T> AccessResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> AccessResult<T> failure(AccessError error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Returns {@link AccessStatus#OK} for a success, otherwise the error's status.
     */
    default AccessStatus status() {
        if (this instanceof Failure<T> failure) {
            return failure.error().status();
        }
        return AccessStatus.OK;
    }

    /**
     * Gets the value if successful, throws if not.
     */
    default T getValue() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException("No value in failed result: " + getError());
    }

    /**
     * Gets the error if failed, throws if successful.
     */
    default AccessError getError() {
        if (this instanceof Failure<T> failure) {
            return failure.error();
        }
        throw new IllegalStateException("No error in successful result");
    }

    default AccessResult<T> onSuccess(Consumer<T> consumer) {
        if (this instanceof Success<T> success) {
            consumer.accept(success.value());
        }
        return this;
    }

    default AccessResult<T> onFailure(Consumer<AccessError> consumer) {
        if (this instanceof Failure<T> failure) {
            consumer.accept(failure.error());
        }
        return this;
    }

    record Success<T>(T value) implements AccessResult<T> {
    }

    record Failure<T>(AccessError error) implements AccessResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
