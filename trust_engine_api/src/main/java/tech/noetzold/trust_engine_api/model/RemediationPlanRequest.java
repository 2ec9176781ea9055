package tech.noetzold.trust_engine_api.model;

import java.util.List;

public record RemediationPlanRequest(List<String> categories) {}
