package com.clarifi.backend.exceptions;

public class InvalidPeriodException extends BadRequestException {

    public InvalidPeriodException(String period) {
        super("Invalid period '" + period + "'. Expected one of: current_month, last_month, last_30_days");
    }
}
