package com.cornerleague.collector.service.quality;

import java.util.Map;

public record QualityAssessment(double score, boolean spam, boolean degraded, Map<String, Double> signals) {}
