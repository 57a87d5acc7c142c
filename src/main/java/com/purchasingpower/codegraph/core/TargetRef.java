package com.purchasingpower.codegraph.core;

import java.util.Objects;

/**
 * Destination of a relationship.
 *
 * <p>A target starts either {@link State#RESOLVED} (the analyzer knew the identity), as a
 * {@link State#PLACEHOLDER} (kind hint plus bare name, or a root-relative path for file
 * placeholders), or {@link State#EXTERNAL}. The resolver turns every placeholder into a resolved
 * target or one of the terminal markers {@link State#UNRESOLVED} / {@link State#AMBIGUOUS}.
 *
 * @param state resolution state
 * @param value identity key when resolved; bare name or path otherwise; import specifier when external
 * @param hint kind hint, only meaningful for placeholders
 * @since 1.0.0
 */
public record TargetRef(State state, String value, KindHint hint) {

    public enum State {
        RESOLVED,
        PLACEHOLDER,
        UNRESOLVED,
        AMBIGUOUS,
        EXTERNAL
    }

    public TargetRef {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(value, "value");
    }

    public static TargetRef resolved(EntityId id) {
        return new TargetRef(State.RESOLVED, id.key(), null);
    }

    public static TargetRef placeholder(KindHint hint, String name) {
        return new TargetRef(State.PLACEHOLDER, name, Objects.requireNonNull(hint, "hint"));
    }

    public static TargetRef unresolved(String name) {
        return new TargetRef(State.UNRESOLVED, name, null);
    }

    public static TargetRef ambiguous(String name) {
        return new TargetRef(State.AMBIGUOUS, name, null);
    }

    public static TargetRef external(String specifier) {
        return new TargetRef(State.EXTERNAL, specifier, null);
    }

    public boolean isPlaceholder() {
        return state == State.PLACEHOLDER;
    }

    public boolean isResolved() {
        return state == State.RESOLVED;
    }

    /**
     * Textual form used in the analysis document and in log lines.
     */
    public String render() {
        return switch (state) {
            case RESOLVED -> value;
            case PLACEHOLDER -> "Placeholder:" + hint.getLabel() + ":" + value;
            case UNRESOLVED -> "Unresolved:" + value;
            case AMBIGUOUS -> "Ambiguous:" + value;
            case EXTERNAL -> "External:" + value;
        };
    }

    @Override
    public String toString() {
        return render();
    }
}
