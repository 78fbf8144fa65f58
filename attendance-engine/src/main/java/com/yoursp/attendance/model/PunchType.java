package com.yoursp.attendance.model;

public enum PunchType {
    CLOCK_IN,
    CLOCK_OUT
}
