package tech.noetzold.trust_engine_api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.trust_engine_api.repository.RiskImpactRepository;
import tech.noetzold.trust_engine_api.service.ControlNormalizer;
import tech.noetzold.trust_engine_api.service.CoverageCalculator;
import tech.noetzold.trust_engine_api.service.DescriptionCanonicalizer;
import tech.noetzold.trust_engine_api.service.RiskImpactModel;
import tech.noetzold.trust_engine_api.service.StalenessDecay;

import java.time.Clock;

/**
 * Wires the pure engine components. They hold no Spring state so tests build them directly.
 */
@Configuration
@EnableConfigurationProperties(RiskProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DescriptionCanonicalizer descriptionCanonicalizer() {
        return new DescriptionCanonicalizer();
    }

    @Bean
    public ControlNormalizer controlNormalizer(DescriptionCanonicalizer canonicalizer) {
        return new ControlNormalizer(canonicalizer);
    }

    @Bean
    public StalenessDecay stalenessDecay(@Value("${trust-engine.coverage.freshness-days:90}") double freshnessDays,
                                         @Value("${trust-engine.coverage.decay-floor:0.5}") double floor) {
        return new StalenessDecay(freshnessDays, floor);
    }

    @Bean
    public CoverageCalculator coverageCalculator(StalenessDecay decay) {
        return new CoverageCalculator(decay);
    }

    @Bean
    public RiskImpactModel riskImpactModel(RiskImpactRepository impactRepo, RiskProperties riskProperties) {
        return new RiskImpactModel(impactRepo, riskProperties.tagMultipliers(), riskProperties.multiplierCeiling());
    }
}
