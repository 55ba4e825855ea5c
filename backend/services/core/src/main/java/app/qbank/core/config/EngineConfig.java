package app.qbank.core.config;

import app.qbank.core.rating.RatingEngine;
import app.qbank.core.rating.RatingSettings;
import app.qbank.core.review.ReviewScheduler;
import app.qbank.core.review.SchedulerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public ReviewScheduler reviewScheduler(SchedulerProps props) {
        SchedulerSettings settings = props.toSettings();
        log.info("Review scheduler: ease [{}, {}] start {} (+{}/-{}), interval [{}, {}] days",
                settings.minEaseFactor(), settings.maxEaseFactor(), settings.initialEaseFactor(),
                settings.easeBonus(), settings.easePenalty(),
                settings.minIntervalDays(), settings.maxIntervalDays());
        return new ReviewScheduler(settings);
    }

    @Bean
    public RatingEngine ratingEngine(RatingProps props) {
        RatingSettings settings = props.toSettings();
        log.info("Rating engine: k={} initial={}", settings.kFactor(), settings.initialRating());
        return new RatingEngine(settings);
    }
}
