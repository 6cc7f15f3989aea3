package com.geekhub.collector.entity;

public enum LogLevel {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
