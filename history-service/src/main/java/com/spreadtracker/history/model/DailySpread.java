package com.spreadtracker.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Running spread statistics for one route on one calendar day (UTC).
 *
 * <p>One row per {@code (date, route)}. Rows are created on the first observation of
 * the day and only ever folded forward afterwards; {@code averageSpread} is maintained
 * incrementally from {@code dataPoints}, never by re-reading observations.
 */
@Data
@NoArgsConstructor
@Table("daily_spreads")
public class DailySpread {

    @Id
    private Long id;

    @Column("spread_date")
    private LocalDate date;

    private String route;

    private String buyExchange;

    private String sellExchange;

    private double highestSpread;

    private double lowestSpread;

    private double averageSpread;

    private int dataPoints;

    private LocalDateTime updatedAt;
}
