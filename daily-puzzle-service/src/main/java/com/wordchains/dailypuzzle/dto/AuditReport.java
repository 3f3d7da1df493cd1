package com.wordchains.dailypuzzle.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AuditReport {
    private int checked;
    private List<String> errors;
    private List<String> warnings;

    public boolean hasBlockingIssues() {
        return !errors.isEmpty();
    }
}
