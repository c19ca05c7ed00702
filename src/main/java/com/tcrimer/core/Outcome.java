package com.tcrimer.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A value or a typed reason why there is none. Used where "cannot compute" is a normal
 * result rather than an exception path.
 */
public final class Outcome<T> {
    public final boolean success;
    public final T value;
    public final CauseCode causeCode;
    public final String owner;
    public final Map<String, Object> details;

    private Outcome(boolean success, T value, CauseCode causeCode, String owner, Map<String, Object> details) {
        this.success = success;
        this.value = value;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.owner = owner == null ? "" : owner;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static <T> Outcome<T> success(T value, String owner) {
        return new Outcome<>(true, value, CauseCode.NONE, owner, Map.of());
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner) {
        return new Outcome<>(false, null, causeCode, owner, Map.of());
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner, Map<String, Object> details) {
        return new Outcome<>(false, null, causeCode, owner, copy(details));
    }

    public static <T> Outcome<T> insufficient(String owner, int required, int available) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required", required);
        details.put("available", available);
        return new Outcome<>(false, null, CauseCode.INSUFFICIENT_DATA, owner, details);
    }

    public boolean isInsufficientData() {
        return !success && causeCode == CauseCode.INSUFFICIENT_DATA;
    }

    /**
     * Re-types a failure so it can be propagated through a different value type.
     */
    public <R> Outcome<R> castFailure() {
        if (success) {
            throw new IllegalStateException("castFailure on successful outcome of " + owner);
        }
        return new Outcome<>(false, null, causeCode, owner, details);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Outcome<?> other)) {
            return false;
        }
        return success == other.success
                && Objects.equals(value, other.value)
                && causeCode == other.causeCode
                && owner.equals(other.owner)
                && details.equals(other.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, value, causeCode, owner, details);
    }

    @Override
    public String toString() {
        if (success) {
            return "Outcome{ok owner=" + owner + ", value=" + value + "}";
        }
        return "Outcome{fail owner=" + owner + ", cause=" + causeCode + ", details=" + details + "}";
    }

    private static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        return new LinkedHashMap<>(in);
    }
}
