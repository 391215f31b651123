package com.whereq.transcribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The installed drain trigger
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DrainTrigger {
    private TriggerInterval interval;
    private Instant installedAt;
}
