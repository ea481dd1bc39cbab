package com.clarifi.backend.services.insights.rules;

import java.util.Optional;

import com.clarifi.backend.dto.dashboard.InsightDTO;
import com.clarifi.backend.services.insights.InsightContext;

public interface InsightRule {
    Optional<InsightDTO> evaluate(InsightContext context);
}
