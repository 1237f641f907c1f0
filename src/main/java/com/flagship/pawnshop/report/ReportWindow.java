package com.flagship.pawnshop.report;

import com.flagship.pawnshop.common.TimeWindows;
import com.flagship.pawnshop.exception.BusinessValidationException;
import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Inclusive calendar window for reports and exports. A missing end means today,
 * a missing start means 30 days before the end.
 */
@Value
class ReportWindow {

    static final int DEFAULT_DAYS = 30;

    LocalDate start;
    LocalDate end;

    /**
     * @throws BusinessValidationException if start is after end
     */
    static ReportWindow resolve(LocalDate startDate, LocalDate endDate, Clock clock) {
        LocalDate end = endDate != null ? endDate : LocalDate.now(clock);
        LocalDate start = startDate != null ? startDate : end.minusDays(DEFAULT_DAYS);
        if (start.isAfter(end)) {
            throw new BusinessValidationException("date_range", "start_date must not be after end_date");
        }
        return new ReportWindow(start, end);
    }

    Instant from(Clock clock) {
        return TimeWindows.startOfDay(start, clock);
    }

    /**
     * Exclusive upper bound.
     */
    Instant to(Clock clock) {
        return TimeWindows.endOfDay(end, clock);
    }
}
