package com.whereq.transcribe.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.transcribe.model.DrainTrigger;
import com.whereq.transcribe.model.TriggerInterval;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Drain trigger state
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TriggerResponse {
    private boolean installed;

    private TriggerInterval interval;

    private Integer intervalMinutes;

    private Instant installedAt;

    public static TriggerResponse from(DrainTrigger trigger) {
        return TriggerResponse.builder()
            .installed(true)
            .interval(trigger.getInterval())
            .intervalMinutes(trigger.getInterval().getMinutes())
            .installedAt(trigger.getInstalledAt())
            .build();
    }

    public static TriggerResponse none() {
        return TriggerResponse.builder()
            .installed(false)
            .build();
    }
}
