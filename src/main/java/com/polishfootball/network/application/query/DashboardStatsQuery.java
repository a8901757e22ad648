package com.polishfootball.network.application.query;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.PastOrPresent;

import java.time.LocalDate;

/**
 * Dashboard statistics request. Both dates are inclusive and compared against creation time (UTC).
 */
public record DashboardStatsQuery(
        LocalDate startDate,

        @PastOrPresent(message = "End date cannot be in the future.")
        LocalDate endDate,

        boolean includeDetails
) {
    @AssertTrue(message = "Start date must be before or equal to end date.")
    public boolean isDateRangeOrdered() {
        return startDate == null || endDate == null || !startDate.isAfter(endDate);
    }
}
