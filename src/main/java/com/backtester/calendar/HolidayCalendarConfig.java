package com.backtester.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

/**
 * Exchange closures the simulation has to step around, bound from {@code backtester.calendar.*}.
 *
 * <p>FULL_HOLIDAY dates drop out of the simulated day sequence, which moves deposit days,
 * calendar rebalances and year-end tax to the neighbouring session. EARLY_CLOSE dates are
 * still simulated. Years missing from the list only skip weekends, so backtests reaching
 * past the configured years silently trade on those holidays.
 */
@Data
@Component
@ConfigurationProperties(prefix = "backtester.calendar")
public class HolidayCalendarConfig {

    /** Label used in log lines only. */
    private String exchange = "NYSE";

    private String timezone = "America/New_York";

    private List<Holiday> holidays = new ArrayList<>();

    /** Dates of every configured entry of the given type. */
    public Set<LocalDate> datesOf(HolidayType type) {
        return holidays.stream()
                .filter(h -> h.getType() == type && h.getDate() != null)
                .map(Holiday::getDate)
                .collect(Collectors.toSet());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Holiday {

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate date;

        private String name;

        private HolidayType type = HolidayType.FULL_HOLIDAY;
    }
}
