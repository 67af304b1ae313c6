package com.wagerdesk.ledger.dto;

import java.time.LocalDateTime;

public record WagerReceipt(Long id, String eventId, String selection, double confidence, int calibrationBucket,
                           LocalDateTime createdAt) {}
