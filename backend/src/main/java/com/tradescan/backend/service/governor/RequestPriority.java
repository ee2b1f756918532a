package com.tradescan.backend.service.governor;

public enum RequestPriority {
    NORMAL,
    HIGH
}
