package os.siafu.schedule;

import os.siafu.SchedulerException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

final class Instants {

    private Instants() {
    }

    static Instant plus(Instant instant, Duration step) {
        try {
            return instant.plus(step);
        } catch (DateTimeException | ArithmeticException e) {
            throw SchedulerException.timeCalculation(instant + " + " + step, e);
        }
    }

    static Duration times(Duration unit, long multiplier) {
        try {
            return unit.multipliedBy(multiplier);
        } catch (ArithmeticException e) {
            throw SchedulerException.timeCalculation(unit + " * " + multiplier, e);
        }
    }
}
