package org.smtbridge.result;

import java.util.Objects;
import java.util.Optional;

/**
 * 单条取值规则的结果：不匹配、匹配（带值），或形状对上了但内容非法。
 */
public final class MatchResult<T> {

    public enum Outcome {
        NO_MATCH,
        MATCH,
        MALFORMED
    }

    private final Outcome outcome;
    private final T value;
    private final String reason;

    private MatchResult(Outcome outcome, T value, String reason) {
        this.outcome = outcome;
        this.value = value;
        this.reason = reason;
    }

    public static <T> MatchResult<T> noMatch() {
        return new MatchResult<>(Outcome.NO_MATCH, null, null);
    }

    public static <T> MatchResult<T> match(T value) {
        return new MatchResult<>(Outcome.MATCH, Objects.requireNonNull(value, "Value cannot be null"), null);
    }

    public static <T> MatchResult<T> malformed(String reason) {
        return new MatchResult<>(Outcome.MALFORMED, null, Objects.requireNonNull(reason, "Reason cannot be null"));
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return switch (outcome) {
            case NO_MATCH -> "NoMatch";
            case MATCH -> "Match(" + value + ")";
            case MALFORMED -> "Malformed(" + reason + ")";
        };
    }
}
