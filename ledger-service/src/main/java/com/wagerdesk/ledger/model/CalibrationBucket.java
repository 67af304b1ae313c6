package com.wagerdesk.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Running settlement totals for one confidence bucket (40, 50, ... 80 percent).
 *
 * <p>Totals only ever grow. {@code actualWinRate} ignores pushes; {@code calibrationError} is
 * {@code |bucket/100 − actualWinRate|}.
 */
@Data
@NoArgsConstructor
@Table("calibration_buckets")
public class CalibrationBucket {

    @Id
    private Long id;

    private int bucket;

    private int totalBets;
    private int wins;
    private int losses;
    private int pushes;

    private Double actualWinRate;
    private Double calibrationError;

    private LocalDateTime updatedAt;

    public double expectedWinRate() {
        return bucket / 100.0;
    }
}
