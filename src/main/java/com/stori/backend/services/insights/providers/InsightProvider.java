package com.stori.backend.services.insights.providers;

import java.util.List;

import com.stori.backend.dto.InsightDTO;
import com.stori.backend.services.insights.MonthlyInsightData;

public interface InsightProvider {
    List<InsightDTO> generate(MonthlyInsightData data);
}
