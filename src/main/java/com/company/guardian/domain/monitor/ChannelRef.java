package com.company.guardian.domain.monitor;

import com.company.guardian.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelRef {
    private String name;

    // Empty means every severity
    @Builder.Default
    private Set<Severity> severities = new HashSet<>();

    public boolean accepts(Severity severity) {
        return severities == null || severities.isEmpty() || severities.contains(severity);
    }
}
