package com.geekhub.collector.entity;

public enum FetchOutcome {
    SUCCESS,
    ERROR
}
