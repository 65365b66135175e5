package it.floro.saber.config;

import it.floro.saber.domain.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Espone la configurazione di analisi come bean immutabile.
 * Gli stadi la ricevono sempre come parametro esplicito dai chiamanti.
 */
@Configuration
@EnableConfigurationProperties({AnalysisProperties.class, DatasetProperties.class})
public class AnalyticsConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsConfiguration.class);

    @Bean
    public AnalysisConfig analysisConfig(AnalysisProperties properties) {
        AnalysisConfig config = properties.toConfig();
        logger.info("Configurazione di analisi: bound ±{}, soglia regressione {}, soglia sottogruppo KPI {}, {} alberi",
                config.clipBound(), config.regressionMinSample(), config.kpiMinSubgroup(), config.trees());
        return config;
    }
}
