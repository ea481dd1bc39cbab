package com.clarifi.backend.dto.dashboard;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecentTransactionDTO {

    UUID id;
    LocalDate date;
    String description;
    BigDecimal amount; // signed, as stored
    String type;
    String categoryName;
    String categoryIcon;
    String categoryColor;
    String merchantName;
}
