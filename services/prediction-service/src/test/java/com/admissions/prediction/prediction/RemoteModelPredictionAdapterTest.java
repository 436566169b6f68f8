package com.admissions.prediction.prediction;

import com.admissions.prediction.exception.PredictionException;
import com.admissions.prediction.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("RemoteModelPredictionAdapter Unit Tests")
class RemoteModelPredictionAdapterTest {

    private MockRestServiceServer server;
    private RemoteModelPredictionAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("http://model-runner.test").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        adapter = new RemoteModelPredictionAdapter(restTemplate);
    }

    @Test
    @DisplayName("Should post features under their dataset names and read the prediction")
    void shouldForwardFeatures() {
        server.expect(requestTo("http://model-runner.test/predict"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.GRE_Score").value(337))
                .andExpect(jsonPath("$.University_Rating").value(4))
                .andExpect(jsonPath("$.CGPA").value(9.65))
                .andRespond(withSuccess("{\"prediction\": 0.91, \"model\": \"admissions_model\"}",
                        MediaType.APPLICATION_JSON));

        double prediction = adapter.run(TestFixtures.sampleFeatures());

        assertThat(prediction).isEqualTo(0.91);
        server.verify();
    }

    @Test
    @DisplayName("Should raise PredictionException when the runner fails")
    void shouldFailOnServerError() {
        server.expect(requestTo("http://model-runner.test/predict"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> adapter.run(TestFixtures.sampleFeatures()))
                .isInstanceOf(PredictionException.class);
    }

    @Test
    @DisplayName("Should raise PredictionException when the answer has no prediction")
    void shouldFailOnMissingPrediction() {
        server.expect(requestTo("http://model-runner.test/predict"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> adapter.run(TestFixtures.sampleFeatures()))
                .isInstanceOf(PredictionException.class)
                .hasMessageContaining("no prediction");
    }
}
