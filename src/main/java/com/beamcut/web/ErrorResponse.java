package com.beamcut.web;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String error; // "INVALID_INPUT", "INFEASIBLE_PART", "REPORT_NOT_FOUND", "INTERNAL_ERROR"
    private String message;
}
