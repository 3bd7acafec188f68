package com.healthwatch.health;

/**
 * Outcome of running one registered check: either the value the check produced or the
 * message of the failure that prevented it.
 * <p>
 * Exactly one of {@code value} and {@code error} is non-null.
 *
 * @param value the check's result on success
 * @param error the failure message on failure
 * @param <T>   result type ({@link DependencyHealth} or {@link IntegrationTestResult})
 */
public record CheckOutcome<T>(T value, String error) {

    public CheckOutcome {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value and error must be set");
        }
    }

    public static <T> CheckOutcome<T> success(T value) {
        return new CheckOutcome<>(value, null);
    }

    public static <T> CheckOutcome<T> failure(String error) {
        return new CheckOutcome<>(null, error);
    }

    public boolean isSuccess() {
        return value != null;
    }
}
