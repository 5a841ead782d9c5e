package com.intelhub.backend.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.intelhub.backend.config.PipelineProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class PipelineDispatcherTest {

    @Mock
    private StagingService stagingService;

    @Mock
    private ClassificationWorker classificationWorker;

    @Mock
    private ThreadPoolTaskExecutor executor;

    private PipelineDispatcher dispatcher;

    // Tasks handed to the executor but not run yet
    private final List<Runnable> queued = new ArrayList<>();

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.setWorkerPoolSize(2);
        dispatcher = new PipelineDispatcher(stagingService, classificationWorker, properties, executor);
    }

    @Test
    void dispatch_shouldDoNothing_whenStopped() {
        dispatcher.dispatch();
        dispatcher.reapExpiredLeases();

        verifyNoInteractions(stagingService, executor);
    }

    @Test
    void dispatch_shouldNeverSubmitMoreThanPoolSize() {
        // Arrange
        dispatcher.start();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        when(stagingService.findClaimable(2)).thenReturn(List.of(first, second));
        doAnswer(invocation -> queued.add(invocation.getArgument(0))).when(executor).execute(any(Runnable.class));

        // Act
        dispatcher.dispatch();
        dispatcher.dispatch();

        // Assert
        assertThat(queued).hasSize(2);
        assertThat(dispatcher.getActiveWorkers()).isEqualTo(2);
        verify(stagingService, times(1)).findClaimable(anyInt());
    }

    @Test
    void dispatch_shouldFreePermit_whenWorkerFinishes() {
        dispatcher.start();
        UUID uuid = UUID.randomUUID();
        when(stagingService.findClaimable(2)).thenReturn(List.of(uuid));
        when(classificationWorker.process(uuid)).thenThrow(new IllegalStateException("boom"));
        doAnswer(invocation -> queued.add(invocation.getArgument(0))).when(executor).execute(any(Runnable.class));

        dispatcher.dispatch();
        queued.get(0).run();

        assertThat(dispatcher.getActiveWorkers()).isZero();
        dispatcher.dispatch();
        verify(stagingService, times(2)).findClaimable(2);
    }

    @Test
    void dispatch_shouldReleasePermit_whenPoolRejects() {
        dispatcher.start();
        UUID uuid = UUID.randomUUID();
        when(stagingService.findClaimable(2)).thenReturn(List.of(uuid));
        doThrow(new TaskRejectedException("full")).when(executor).execute(any(Runnable.class));

        dispatcher.dispatch();

        assertThat(dispatcher.getActiveWorkers()).isZero();
        verify(classificationWorker, never()).process(any());
    }

    @Test
    void reapExpiredLeases_shouldReleaseLeases_whenRunning() {
        dispatcher.start();

        dispatcher.reapExpiredLeases();

        verify(stagingService).releaseExpiredLeases(any());
    }
}
