package com.triprelay.domain;

import com.triprelay.failure.FailureCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Failed-attempt history of one message id (in memory only)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttemptRecord {

    private String messageId;
    private int count;
    private Instant lastAttemptAt;
    private String lastFailureReason;
    private FailureCategory lastCategory;
}
