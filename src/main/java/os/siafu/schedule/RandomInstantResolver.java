package os.siafu.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Draws uniformly distributed instants from a half-open range {@code [start, end)}.
 */
public class RandomInstantResolver {

    private final Random random;

    public RandomInstantResolver() {
        this(new Random());
    }

    public RandomInstantResolver(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @return an instant {@code r} with {@code start <= r < end}, or {@link Optional#empty()} if {@code end} is not
     * after {@code start}
     */
    public Optional<Instant> resolve(Instant start, Instant end) {
        if (!end.isAfter(start)) {
            return Optional.empty();
        }

        Duration range = Duration.between(start, end);
        try {
            return Optional.of(start.plusNanos(random.nextLong(range.toNanos())));
        } catch (ArithmeticException nanosOverflow) {
            return Optional.of(start.plusMillis(random.nextLong(range.toMillis())));
        }
    }
}
