package com.wagerdesk.ledger.model;

public enum LossCategory {
    INJURY_MISS,
    B2B_FACTOR,
    REFEREE,
    LINE_MOVEMENT,
    PUBLIC_TRAP,
    BAD_BEAT,
    MODEL_ERROR,
    OTHER
}
