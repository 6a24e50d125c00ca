package com.backtester.domain.model;

import java.time.LocalDate;
import java.util.List;
import lombok.Value;

@Value
public class PositionSnapshot {

    LocalDate date;
    List<Position> positions;
}
