package com.company.guardian.event;

import com.company.guardian.domain.ExecutionRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ExecutionCompletedEvent {
    private final ExecutionRecord execution;
}
