package com.geekhub.collector.dto;

public record SummaryResponse(boolean success, String summary, String model) {
}
