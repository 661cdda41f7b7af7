package com.airsentinel.service.query;

import java.util.List;

public record HistoryResponse(String city, int hours, int count, List<CurrentReading> data) {
}
