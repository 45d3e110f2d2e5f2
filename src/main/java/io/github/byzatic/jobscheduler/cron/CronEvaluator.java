package io.github.byzatic.jobscheduler.cron;

import io.github.byzatic.jobscheduler.exceptions.InvalidScheduleSpecException;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Evaluates cron expressions.
 * <p>
 * Grammar: five fields {@code min hour dom mon dow} or six with a leading seconds field. Every field accepts
 * {@code *}, single values, ranges {@code a-b}, steps {@code * /n}, {@code a-b/n}, {@code a/n} and comma lists.
 * Months accept {@code JAN..DEC}, days of week {@code SUN..SAT}, and {@code 0} or {@code 7} for Sunday.
 * When both day-of-month and day-of-week are restricted, a day matches if either of them matches.
 *
 * <h3>Time zones</h3>
 * Fields are matched against the civil time of the given zone, then converted to an instant:
 * <ul>
 *   <li>a local time that does not exist (spring-forward gap) resolves to the first valid instant after the gap,
 *       i.e. the transition instant;</li>
 *   <li>a local time that occurs twice (fall-back overlap) resolves to the earlier instant only, so it fires once.</li>
 * </ul>
 * Stateless; safe to call from any number of threads.
 */
public final class CronEvaluator {
    private CronEvaluator() {
    }

    /**
     * @param expr     cron expression
     * @param timezone zone whose civil time the fields describe
     * @param after    exclusive lower bound
     * @return the first matching instant strictly after {@code after}
     * @throws InvalidScheduleSpecException if the expression does not parse or never fires again
     */
    public static @NotNull Instant nextOccurrence(@NotNull String expr, @NotNull ZoneId timezone, @NotNull Instant after)
            throws InvalidScheduleSpecException {
        Objects.requireNonNull(timezone, "timezone");
        Objects.requireNonNull(after, "after");
        CronExpr parsed = CronExpr.parse(expr);
        return parsed.next(after, timezone)
                .orElseThrow(() -> new InvalidScheduleSpecException("Cron has no future fire time: " + expr));
    }

    /**
     * Checks the grammar only.
     */
    public static void validate(@NotNull String expr) throws InvalidScheduleSpecException {
        CronExpr.parse(expr);
    }
}
