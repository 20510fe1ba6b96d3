package com.example.batchrunner.checkpoint;

public enum ItemOutcome {
    COMPLETED,
    FAILED
}
