package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.PeriodType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * An excise reporting period. {@code number} is the month (1-12) or quarter (1-4),
 * and is ignored for annual periods.
 */
public final class ReportingPeriod {

    private final PeriodType type;
    private final int year;
    private final int number;

    private ReportingPeriod(PeriodType type, int year, int number) {
        this.type = type;
        this.year = year;
        this.number = number;
    }

    @JsonCreator
    public static ReportingPeriod of(@JsonProperty("type") PeriodType type,
                                     @JsonProperty("year") int year,
                                     @JsonProperty("number") Integer number) {
        if (type == null) {
            throw new IllegalArgumentException("Period type is required");
        }
        if (year < 1900 || year > 9999) {
            throw new IllegalArgumentException("Invalid year: " + year);
        }
        int n = number == null ? 1 : number;
        switch (type) {
            case MONTHLY -> requireRange(n, 12, "month");
            case QUARTERLY -> requireRange(n, 4, "quarter");
            case ANNUAL -> n = 1;
        }
        return new ReportingPeriod(type, year, n);
    }

    public static ReportingPeriod monthly(int year, int month) {
        return of(PeriodType.MONTHLY, year, month);
    }

    public static ReportingPeriod quarterly(int year, int quarter) {
        return of(PeriodType.QUARTERLY, year, quarter);
    }

    public static ReportingPeriod annual(int year) {
        return of(PeriodType.ANNUAL, year, 1);
    }

    private static void requireRange(int n, int max, String what) {
        if (n < 1 || n > max) {
            throw new IllegalArgumentException("Invalid " + what + ": " + n);
        }
    }

    public PeriodType getType() {
        return type;
    }

    public int getYear() {
        return year;
    }

    public int getNumber() {
        return number;
    }

    /**
     * First day of the period.
     */
    public LocalDate startDate() {
        return switch (type) {
            case MONTHLY -> LocalDate.of(year, number, 1);
            case QUARTERLY -> LocalDate.of(year, (number - 1) * 3 + 1, 1);
            case ANNUAL -> LocalDate.of(year, 1, 1);
        };
    }

    /**
     * Day after the last day of the period.
     */
    public LocalDate endDateExclusive() {
        return switch (type) {
            case MONTHLY -> startDate().plusMonths(1);
            case QUARTERLY -> startDate().plusMonths(3);
            case ANNUAL -> startDate().plusYears(1);
        };
    }

    @JsonIgnore
    public String getLabel() {
        return switch (type) {
            case MONTHLY -> String.format("%d-%02d", year, number);
            case QUARTERLY -> String.format("%d-Q%d", year, number);
            case ANNUAL -> String.valueOf(year);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReportingPeriod)) {
            return false;
        }
        ReportingPeriod that = (ReportingPeriod) o;
        return year == that.year && number == that.number && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, year, number);
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
