package com.clarifi.backend.dto.dashboard;

import java.util.Map;

import com.clarifi.backend.enums.InsightSeverity;
import com.clarifi.backend.enums.InsightType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InsightDTO {

    String id;
    InsightType type;
    String title;
    String description;
    InsightSeverity severity;
    boolean actionable;
    Map<String, Object> metadata;
}
