package com.stori.backend.services;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.stori.backend.exceptions.BadRequestException;

final class Months {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM");

    private Months() {
    }

    /**
     * @throws BadRequestException unless the value is {@code YYYY-MM}
     */
    static YearMonth parse(String month) {
        if (month == null || month.isBlank()) {
            throw new BadRequestException("month is required");
        }
        try {
            return YearMonth.parse(month.trim(), FORMAT);
        } catch (DateTimeParseException e) {
            throw new BadRequestException("invalid month format, expected YYYY-MM");
        }
    }
}
