package tech.noetzold.trust_engine_api.model;

import java.util.List;

public record ExceptionMatch(String patternId, List<StakeholderRole> route, int slaMinutes, double confidence) {}
