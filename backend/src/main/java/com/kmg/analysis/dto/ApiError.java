package com.kmg.analysis.dto;

public record ApiError(int status, String error, String message) {
}
