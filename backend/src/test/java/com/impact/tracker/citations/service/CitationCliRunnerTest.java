package com.impact.tracker.citations.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.impact.tracker.citations.model.CitationRunRequest;
import com.impact.tracker.citations.model.CitationRunSummary;
import com.impact.tracker.citations.persistence.SnapshotNotFoundException;
import com.impact.tracker.citations.persistence.SnapshotStoreException;
import com.impact.tracker.config.TrackerProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

@ExtendWith(MockitoExtension.class)
class CitationCliRunnerTest {
  private static final CitationRunSummary SUMMARY =
      new CitationRunSummary(
          Instant.now(), Instant.now(), 1, 2, "snapshot.json", true, List.of(), List.of());

  @Mock private CitationRunService citationRunService;
  @Mock private ConfigurableApplicationContext applicationContext;

  private TrackerProperties properties;
  private CitationCliRunner runner;

  @BeforeEach
  void setUp() {
    properties = new TrackerProperties();
    properties.getCli().setRun(true);
    properties.getCli().setExitAfterRun(false);
    runner = new CitationCliRunner(properties, citationRunService, applicationContext);
  }

  @Test
  void parsesCommaSeparatedCutoffDates() {
    assertThat(CitationCliRunner.parseCutoffDates(" 2024-01-01, ,2023-06-01 "))
        .containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2023, 6, 1));
    assertThat(CitationCliRunner.parseCutoffDates("")).isEmpty();
    assertThat(CitationCliRunner.parseCutoffDates(null)).isEmpty();
    assertThatThrownBy(() -> CitationCliRunner.parseCutoffDates("2024-13-01"))
        .isInstanceOf(TrackerConfigurationException.class);
  }

  @Test
  void runsFullCollectionWithConfiguredDates() {
    properties.getCli().setCutoffDates("2023-06-01");
    properties.getCli().setWriteReport(false);
    CitationRunRequest expected = new CitationRunRequest(List.of(LocalDate.of(2023, 6, 1)), false);
    when(citationRunService.run(expected)).thenReturn(SUMMARY);

    runner.run(new DefaultApplicationArguments());

    verify(citationRunService).run(expected);
    verify(citationRunService, never()).reaggregateAndReport(any());
  }

  @Test
  void reaggregateOnlySkipsProviders() {
    properties.getCli().setReaggregateOnly(true);
    when(citationRunService.reaggregateAndReport(any())).thenReturn(SUMMARY);

    runner.run(new DefaultApplicationArguments());

    verify(citationRunService, never()).run(any());
  }

  @Test
  void successfulRunExitsWithZero() {
    when(citationRunService.run(any())).thenReturn(SUMMARY);

    assertThat(runner.execute()).isZero();
  }

  @Test
  void invalidConfigurationAndMissingSnapshotExitWithOne() {
    properties.getCli().setCutoffDates("yesterday");
    assertThat(runner.execute()).isEqualTo(1);
    verifyNoInteractions(citationRunService);

    properties.getCli().setCutoffDates("");
    properties.getCli().setReaggregateOnly(true);
    when(citationRunService.reaggregateAndReport(any()))
        .thenThrow(new SnapshotNotFoundException("no citation snapshot"));
    assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    assertThat(runner.execute()).isEqualTo(1);
  }

  @Test
  void runFailuresAfterStartupExitWithOne() {
    when(citationRunService.run(any()))
        .thenThrow(new CitationRunAbortedException("citation collection interrupted"))
        .thenThrow(new SnapshotStoreException("failed to write snapshot", new IOException("disk full")))
        .thenThrow(new UncheckedIOException("failed to write report sheet", new IOException("read-only")));

    assertThat(runner.execute()).isEqualTo(1);
    assertThat(runner.execute()).isEqualTo(1);
    assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
  }

  @Test
  void disabledRunnerDoesNothing() {
    properties.getCli().setRun(false);

    runner.run(new DefaultApplicationArguments());

    verifyNoInteractions(citationRunService, applicationContext);
  }
}
