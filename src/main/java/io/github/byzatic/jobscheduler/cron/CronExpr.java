package io.github.byzatic.jobscheduler.cron;

import io.github.byzatic.jobscheduler.exceptions.InvalidScheduleSpecException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

// ======== Cron expression, 5 or 6 fields ========
final class CronExpr {
    // 6 полей: sec min hour dom mon dow
    // 5 полей:     min hour dom mon dow  (sec=0)
    private static final int SEARCH_YEARS = 10;
    private static final String[] MONTH_NAMES =
            {"JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"};
    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    private final String source;
    private final BitSet seconds = new BitSet(60);
    private final BitSet minutes = new BitSet(60);
    private final BitSet hours = new BitSet(24);
    private final BitSet dom = new BitSet(32);    // 1..31
    private final BitSet months = new BitSet(13); // 1..12
    private final BitSet dow = new BitSet(8);     // 0..6 (0=Sunday), 7 folded into 0
    private boolean domRestricted;
    private boolean dowRestricted;

    private CronExpr(String source) {
        this.source = source;
    }

    static CronExpr parse(String s) throws InvalidScheduleSpecException {
        if (s == null || s.isBlank()) {
            throw new InvalidScheduleSpecException("Cron expression is empty");
        }
        String[] p = s.trim().split("\\s+");
        if (p.length != 5 && p.length != 6) {
            throw new InvalidScheduleSpecException("Cron must have 5 or 6 fields (with seconds): " + s);
        }

        CronExpr ce = new CronExpr(s.trim());
        int idx = 0;
        try {
            if (p.length == 6) {
                ce.parseField(p[idx++], 0, 59, ce.seconds);
            } else {
                ce.seconds.set(0);
            }
            ce.parseField(p[idx++], 0, 59, ce.minutes);
            ce.parseField(p[idx++], 0, 23, ce.hours);
            ce.domRestricted = !p[idx].startsWith("*");
            ce.parseField(p[idx++], 1, 31, ce.dom);
            ce.parseField(replaceNames(p[idx++], MONTH_NAMES, 1), 1, 12, ce.months);
            ce.dowRestricted = !p[idx].startsWith("*");
            ce.parseField(replaceNames(p[idx], DAY_NAMES, 0), 0, 7, ce.dow);
        } catch (NumberFormatException e) {
            throw new InvalidScheduleSpecException("Malformed number in cron expression: " + s, e);
        }
        if (ce.dow.get(7)) {
            ce.dow.set(0);
            ce.dow.clear(7);
        }
        return ce;
    }

    private static String replaceNames(String field, String[] names, int firstValue) {
        String upper = field.toUpperCase(Locale.ROOT);
        for (int i = 0; i < names.length; i++) {
            upper = upper.replace(names[i], String.valueOf(i + firstValue));
        }
        return upper;
    }

    private void parseField(String f, int min, int max, BitSet out) throws InvalidScheduleSpecException {
        for (String part : f.split(",", -1)) {
            if (part.isEmpty()) {
                throw new InvalidScheduleSpecException("Empty list element in cron field: " + f);
            }
            String rangePart = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                rangePart = part.substring(0, slash);
                step = Integer.parseInt(part.substring(slash + 1));
                if (step <= 0 || step > max - min) {
                    throw new InvalidScheduleSpecException("Step must be in [1-" + (max - min) + "]: " + part);
                }
            }
            int start;
            int end;
            if (rangePart.equals("*")) {
                start = min;
                end = max;
            } else if (rangePart.contains("-")) {
                String[] r = rangePart.split("-", -1);
                if (r.length != 2) {
                    throw new InvalidScheduleSpecException("Malformed range: " + part);
                }
                start = Integer.parseInt(r[0]);
                end = Integer.parseInt(r[1]);
            } else {
                start = Integer.parseInt(rangePart);
                // "5/15" означает 5..max с шагом 15
                end = slash >= 0 ? max : start;
            }
            if (start < min || end > max || start > end) {
                throw new InvalidScheduleSpecException("Out of range [" + min + "-" + max + "]: " + part);
            }
            for (int v = start; v <= end; v += step) {
                out.set(v);
                if (end - v < step) break;
            }
        }
    }

    /**
     * First instant strictly after {@code after} whose civil time in {@code zone} matches the expression.
     * Local times inside a DST gap resolve to the end of the gap, ambiguous local times to the earlier instant.
     */
    Optional<Instant> next(Instant after, ZoneId zone) {
        LocalDateTime from = LocalDateTime.ofInstant(after, zone).withNano(0).plusSeconds(1);
        LocalDateTime limit = from.plusYears(SEARCH_YEARS);
        while (!from.isAfter(limit)) {
            LocalDateTime candidate = nextLocalMatch(from, limit);
            if (candidate == null) {
                return Optional.empty();
            }
            Instant instant = resolve(candidate, zone);
            if (instant.isAfter(after)) {
                return Optional.of(instant);
            }
            // кандидат попал во вторую половину перекрытия (fall-back), идём дальше
            from = candidate.plusSeconds(1);
        }
        return Optional.empty();
    }

    private LocalDateTime nextLocalMatch(LocalDateTime start, LocalDateTime limit) {
        LocalDateTime z = start;
        while (!z.isAfter(limit)) {
            if (!months.get(z.getMonthValue())) {
                z = z.plusMonths(1).withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
                continue;
            }
            if (!dayMatches(z.toLocalDate())) {
                z = z.plusDays(1).truncatedTo(ChronoUnit.DAYS);
                continue;
            }
            int h = hours.nextSetBit(z.getHour());
            if (h < 0) {
                z = z.plusDays(1).truncatedTo(ChronoUnit.DAYS);
                continue;
            }
            if (h != z.getHour()) {
                z = z.withHour(h).withMinute(0).withSecond(0);
            }
            int m = minutes.nextSetBit(z.getMinute());
            if (m < 0) {
                z = z.plusHours(1).truncatedTo(ChronoUnit.HOURS);
                continue;
            }
            if (m != z.getMinute()) {
                z = z.withMinute(m).withSecond(0);
            }
            int s = seconds.nextSetBit(z.getSecond());
            if (s < 0) {
                z = z.plusMinutes(1).truncatedTo(ChronoUnit.MINUTES);
                continue;
            }
            return z.withSecond(s);
        }
        return null;
    }

    private boolean dayMatches(LocalDate date) {
        boolean domMatch = dom.get(date.getDayOfMonth());
        boolean dowMatch = dow.get(date.getDayOfWeek().getValue() % 7);
        if (domRestricted && dowRestricted) {
            return domMatch || dowMatch;
        }
        return domMatch && dowMatch;
    }

    static Instant resolve(LocalDateTime local, ZoneId zone) {
        ZoneRules rules = zone.getRules();
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        if (offsets.size() == 1) {
            return local.toInstant(offsets.get(0));
        }
        ZoneOffsetTransition transition = rules.getTransition(local);
        if (offsets.isEmpty()) {
            // spring-forward: первое валидное мгновение после разрыва
            return transition.getInstant();
        }
        // fall-back: берём более раннее из двух мгновений
        return local.toInstant(transition.getOffsetBefore());
    }

    @Override
    public String toString() {
        return source;
    }
}
