package com.impact.tracker.citations.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReasonCodeClassifierTest {

    @Test
    void classifiesHttpStatuses() {
        assertThat(ReasonCodeClassifier.fromHttpStatus(429)).isEqualTo(ReasonCodeClassifier.HTTP_429_RATE_LIMIT);
        assertThat(ReasonCodeClassifier.fromHttpStatus(403)).isEqualTo(ReasonCodeClassifier.HTTP_401_403);
        assertThat(ReasonCodeClassifier.fromHttpStatus(404)).isEqualTo(ReasonCodeClassifier.HTTP_404);
        assertThat(ReasonCodeClassifier.fromHttpStatus(503)).isEqualTo(ReasonCodeClassifier.HTTP_5XX);
        assertThat(ReasonCodeClassifier.fromHttpStatus(400)).isEqualTo(ReasonCodeClassifier.HTTP_4XX);
    }

    @Test
    void onlyTransientReasonsAreRetryable() {
        assertThat(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.TIMEOUT)).isTrue();
        assertThat(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.HTTP_429_RATE_LIMIT)).isTrue();
        assertThat(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.HTTP_404)).isFalse();
        assertThat(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.PARSING_FAILED)).isFalse();
    }
}
