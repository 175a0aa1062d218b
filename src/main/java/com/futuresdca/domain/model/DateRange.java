package com.futuresdca.domain.model;

import java.time.LocalDate;

public record DateRange(LocalDate startDate, LocalDate endDate) {}
