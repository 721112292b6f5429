package io.github.hotbrkm.autobulk.dispatcher.schedule;

import org.springframework.scheduling.support.CronExpression;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Standard 5-field cron expression (minute, hour, day-of-month, month, day-of-week).
 * <p>
 * Evaluation is delegated to Spring's {@link CronExpression} with a fixed zero seconds field.
 * Spring requires day-of-month and day-of-week to match together, whereas classic cron fires when
 * either matches once both are restricted. In that case the expression is split into a
 * day-of-month variant and a day-of-week variant and the earlier match wins.
 */
public final class CronSchedule {

    private static final int FIELD_COUNT = 5;
    private static final Map<String, String> MACROS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *");

    private final String expression;
    private final List<CronExpression> variants;

    private CronSchedule(String expression, List<CronExpression> variants) {
        this.expression = expression;
        this.variants = variants;
    }

    /**
     * Parses a 5-field expression or one of the {@code @daily}-style macros.
     *
     * @throws ScheduleParseException if the expression is blank, has the wrong field count or is rejected by the parser
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleParseException("Cron expression must not be blank");
        }
        String trimmed = expression.trim();
        String fiveFields = MACROS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
        String[] fields = fiveFields.split("\\s+");
        if (fields.length != FIELD_COUNT) {
            throw new ScheduleParseException("Cron expression must have " + FIELD_COUNT + " fields but was '" + trimmed + "'");
        }

        String minute = fields[0];
        String hour = fields[1];
        String dayOfMonth = fields[2];
        String month = fields[3];
        String dayOfWeek = fields[4];

        List<CronExpression> variants = new ArrayList<>(2);
        if (isRestricted(dayOfMonth) && isRestricted(dayOfWeek)) {
            variants.add(toSpring(trimmed, minute, hour, dayOfMonth, month, "*"));
            variants.add(toSpring(trimmed, minute, hour, "*", month, dayOfWeek));
        } else {
            variants.add(toSpring(trimmed, minute, hour, dayOfMonth, month, dayOfWeek));
        }
        return new CronSchedule(trimmed, List.copyOf(variants));
    }

    /**
     * Returns the earliest matching time strictly after {@code after}, in the zone of {@code after}.
     * Empty when the expression can never fire (e.g. February 30th).
     */
    public Optional<ZonedDateTime> next(ZonedDateTime after) {
        ZonedDateTime earliest = null;
        for (CronExpression variant : variants) {
            ZonedDateTime candidate = variant.next(after);
            if (candidate != null && (earliest == null || candidate.isBefore(earliest))) {
                earliest = candidate;
            }
        }
        return Optional.ofNullable(earliest);
    }

    public String getExpression() {
        return expression;
    }

    private static boolean isRestricted(String field) {
        return !"*".equals(field) && !"?".equals(field);
    }

    private static CronExpression toSpring(String original, String minute, String hour, String dayOfMonth,
                                           String month, String dayOfWeek) {
        String springExpression = String.join(" ", "0", minute, hour, dayOfMonth, month, dayOfWeek);
        try {
            return CronExpression.parse(springExpression);
        } catch (IllegalArgumentException e) {
            throw new ScheduleParseException("Invalid cron expression '" + original + "': " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
