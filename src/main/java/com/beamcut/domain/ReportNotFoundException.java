package com.beamcut.domain;

import lombok.Getter;

@Getter
public class ReportNotFoundException extends CuttingException {

    private final long requestId;

    public ReportNotFoundException(long requestId) {
        super("No cutting report with id " + requestId);
        this.requestId = requestId;
    }
}
