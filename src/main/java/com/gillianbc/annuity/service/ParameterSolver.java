package com.gillianbc.annuity.service;

import com.gillianbc.annuity.model.SearchDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;

/**
 * Bounded one-dimensional search for the value at which an objective ratio reaches 1.
 * <p>
 * The acceptance band is [1 - delta, 1]. A ratio above 1 always counts as an overshoot, however
 * loose the tolerance. delta starts at 1e-10 and is widened tenfold after each tier of restarts.
 * Every loop is bounded: 18 tiers, 11 restarts per tier, 1000 steps per restart.
 */
@Slf4j
@Service
public class ParameterSolver {

    static final double INITIAL_DELTA = 1e-10;
    static final int DELTA_TIERS = 18;
    static final int RETRY_COUNT = 10;
    static final int MAX_STEPS = 1000;

    /**
     * @param objective    maps a trial value to a ratio; 1 means converged
     * @param direction    INCREASING halves the step after moving down, DECREASING after moving up
     * @param initialStep  first step size; restart r uses initialStep * 2^r
     * @param initialValue starting trial value for every restart
     * @return the accepted value, or empty if nothing was accepted or the accepted value is negative
     */
    public OptionalDouble find(DoubleUnaryOperator objective,
                               SearchDirection direction,
                               double initialStep,
                               double initialValue) {
        Objects.requireNonNull(objective, "objective must not be null");
        Objects.requireNonNull(direction, "direction must not be null");

        double delta = INITIAL_DELTA;
        for (int tier = 0; tier < DELTA_TIERS; tier++) {
            double lower = 1 - delta;
            for (int retry = 0; retry <= RETRY_COUNT; retry++) {
                double value = initialValue;
                double step = initialStep * Math.pow(2, retry);
                for (int i = 0; i < MAX_STEPS; i++) {
                    double ratio = objective.applyAsDouble(value);
                    if (ratio < lower) {
                        value -= step;
                        if (direction == SearchDirection.INCREASING) {
                            step = step / 2;
                        }
                    } else if (ratio <= 1) {
                        if (value < 0) {
                            log.debug("Search settled on negative value {} (tier {}, retry {})", value, tier, retry);
                            return OptionalDouble.empty();
                        }
                        log.debug("Search accepted {} at ratio {} (tier {}, retry {}, step {})", value, ratio, tier, retry, i);
                        return OptionalDouble.of(value);
                    } else {
                        value += step;
                        if (direction == SearchDirection.DECREASING) {
                            step = step / 2;
                        }
                    }
                }
            }
            delta *= 10;
        }

        log.debug("Search exhausted {} tolerance tiers without converging", DELTA_TIERS);
        return OptionalDouble.empty();
    }

    /**
     * Same as {@link #find} but snaps the result to whole cents: down for INCREASING, up for DECREASING.
     */
    public OptionalDouble findMoneyParameter(DoubleUnaryOperator objective,
                                             SearchDirection direction,
                                             double initialStep,
                                             double initialValue) {
        OptionalDouble value = find(objective, direction, initialStep, initialValue);
        if (value.isEmpty()) {
            return value;
        }
        double money = direction == SearchDirection.INCREASING
                ? roundDown(value.getAsDouble(), 2)
                : roundUp(value.getAsDouble(), 2);
        return OptionalDouble.of(money);
    }

    public static double roundDown(double value, int decimals) {
        double exp = Math.pow(10, decimals);
        return Math.floor(value * exp) / exp;
    }

    public static double roundUp(double value, int decimals) {
        double exp = Math.pow(10, decimals);
        return Math.ceil(value * exp) / exp;
    }
}
