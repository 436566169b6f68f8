package com.admissions.prediction.config;

import com.admissions.prediction.prediction.LinearModelPredictionAdapter;
import com.admissions.prediction.prediction.PredictionAdapter;
import com.admissions.prediction.prediction.RemoteModelPredictionAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "model.mode=remote",
        "model.remote.base-url=http://model-runner.test"
})
@ActiveProfiles("test")
@DisplayName("Remote model mode wiring")
class RemoteModeContextTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private PredictionAdapter predictionAdapter;

    @Test
    @DisplayName("Should wire the HTTP adapter instead of the in-process model")
    void shouldUseRemoteAdapter() {
        assertThat(predictionAdapter).isInstanceOf(RemoteModelPredictionAdapter.class);
        assertThat(context.getBeansOfType(LinearModelPredictionAdapter.class)).isEmpty();
        assertThat(context.containsBean("modelRestTemplate")).isTrue();
    }
}
