package app.qbank.core;

import app.qbank.core.analytics.AnalyticsProps;
import app.qbank.core.analytics.ProgressAnalytics;
import app.qbank.core.bank.QuestionBankStore;
import app.qbank.core.bank.StudyProps;
import app.qbank.core.bank.StudyService;
import app.qbank.core.rating.RatingEngine;
import app.qbank.core.review.ReviewScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CoreApplicationTests {

	@Autowired
	ReviewScheduler scheduler;

	@Autowired
	RatingEngine ratingEngine;

	@Autowired
	StudyProps studyProps;

	@Autowired
	StudyService studyService;

	@Autowired
	QuestionBankStore store;

	@Autowired
	AnalyticsProps analyticsProps;

	@Autowired
	ProgressAnalytics analytics;

	@Test
	void contextLoads() {
		assertThat(studyService).isNotNull();
		assertThat(store).isNotNull();
		assertThat(analytics).isNotNull();
	}

	@Test
	void bindsEngineSettingsFromConfiguration() {
		assertThat(scheduler.settings().minEaseFactor()).isEqualTo(1.3);
		assertThat(scheduler.settings().maxIntervalDays()).isEqualTo(365.0);
		assertThat(ratingEngine.settings().kFactor()).isEqualTo(16.0);
		assertThat(ratingEngine.initialRating()).isEqualTo(1200.0);
		assertThat(studyProps.recommendedSpread()).isEqualTo(200.0);
		assertThat(studyProps.zone()).isEqualTo(ZoneId.of("UTC"));
		assertThat(studyProps.targetSuccessRate()).isEqualTo(0.7);
		assertThat(analyticsProps).isEqualTo(AnalyticsProps.defaults());
	}
}
