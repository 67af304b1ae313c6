package com.wagerdesk.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Root-cause record for a high-confidence loss. At most one per wager.
 */
@Data
@NoArgsConstructor
@Table("loss_analysis")
public class LossAnalysis {

    @Id
    private Long id;

    private Long wagerId;

    /** Enum name of {@link LossCategory}. */
    private String category;
    private String primaryFactor;
    private String lesson;

    /** In [0, 1]. */
    private double severity;

    private LocalDateTime createdAt;
}
