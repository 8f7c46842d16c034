package os.siafu.schedule;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Recurs on the instants matched by a {@link CronExpression}. Unlike the fixed interval rules the next run is
 * computed from the current time, so a backlog of missed runs collapses into a single run.
 */
public final class CronRule implements RecurrenceRule {

    private final CronExpression expression;

    public CronRule(CronExpression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public CronExpression getExpression() {
        return expression;
    }

    @Override
    public Optional<Instant> next(Instant previous, Instant now) {
        return expression.nextAfter(now);
    }

    @Override
    public Optional<Instant> defaultFirstRun(Instant now) {
        return expression.nextAfter(now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return expression.equals(((CronRule) o).expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return "CronRule{" +
                "expression=" + expression +
                '}';
    }
}
