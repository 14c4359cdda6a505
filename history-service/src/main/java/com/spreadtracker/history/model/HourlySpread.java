package com.spreadtracker.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Same fold as {@link DailySpread}, bucketed by the hour. {@code hourTimestamp} is
 * truncated to the hour (UTC).
 */
@Data
@NoArgsConstructor
@Table("hourly_spreads")
public class HourlySpread {

    @Id
    private Long id;

    private LocalDateTime hourTimestamp;

    private String route;

    private String buyExchange;

    private String sellExchange;

    private double highestSpread;

    private double lowestSpread;

    private double averageSpread;

    private int dataPoints;

    private LocalDateTime updatedAt;
}
