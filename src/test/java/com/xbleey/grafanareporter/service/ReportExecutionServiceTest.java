package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.enums.ReportFormat;
import com.xbleey.grafanareporter.exception.EmailDeliveryException;
import com.xbleey.grafanareporter.exception.RenderException;
import com.xbleey.grafanareporter.model.ReportJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.slf4j.MDC;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static com.xbleey.grafanareporter.support.ReportJobs.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ReportExecutionServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-05T08:30:00Z");

    private GrafanaRenderClient renderClient;
    private ReportEmailSender emailSender;
    private AsyncTaskExecutor executor;
    private ReportExecutionService service;
    private final RenderedReport report = new RenderedReport(new byte[]{1}, ReportFormat.PNG);

    @BeforeEach
    void setUp() {
        renderClient = mock(GrafanaRenderClient.class);
        emailSender = mock(ReportEmailSender.class);
        executor = mock(AsyncTaskExecutor.class);
        service = new ReportExecutionService(renderClient, emailSender, executor,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void executeRendersThenMails() {
        ReportJob job = job("job-1", "0 8 * * *");
        when(renderClient.render(job)).thenReturn(report);

        service.execute(job);

        InOrder order = inOrder(renderClient, emailSender);
        order.verify(renderClient).render(job);
        order.verify(emailSender).sendReport(job, report);
    }

    @Test
    void renderFailureAbortsRun() {
        ReportJob job = job("job-1", "0 8 * * *");
        when(renderClient.render(job)).thenThrow(new RenderException(500, "boom"));

        assertThatThrownBy(() -> service.execute(job)).isInstanceOf(RenderException.class);
        verifyNoInteractions(emailSender);
    }

    @Test
    void executeTagsLogContextWithJobId() {
        ReportJob job = job("job-7", "0 8 * * *");
        AtomicReference<String> seen = new AtomicReference<>();
        when(renderClient.render(job)).thenAnswer(invocation -> {
            seen.set(MDC.get("job.id"));
            return report;
        });

        service.execute(job);

        assertThat(seen.get()).isEqualTo("job-7");
        assertThat(MDC.get("job.id")).isNull();
    }

    @Test
    void submitAcknowledgesBeforeRunning() {
        ReportJob job = job("job-1", "0 8 * * *");
        when(renderClient.render(any())).thenReturn(report);

        ExecutionAcknowledgement acknowledgement = service.submit(job);

        assertThat(acknowledgement.jobId()).isEqualTo("job-1");
        assertThat(acknowledgement.submittedAt()).isEqualTo(NOW);
        assertThat(acknowledgement.message()).isEqualTo("Job execution started");
        verifyNoInteractions(renderClient);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).execute(task.capture());
        task.getValue().run();
        verify(renderClient).render(any());
        verify(emailSender).sendReport(any(), any());
    }

    @Test
    void detachedAndScheduledFailuresAreContained() {
        ReportJob job = job("job-1", "0 8 * * *");
        when(renderClient.render(any())).thenReturn(report);
        doThrow(new EmailDeliveryException("smtp down", new RuntimeException("smtp down")))
                .when(emailSender).sendReport(any(), any());

        assertThatCode(() -> service.runScheduled(job)).doesNotThrowAnyException();

        service.submit(job);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).execute(task.capture());
        assertThatCode(() -> task.getValue().run()).doesNotThrowAnyException();
    }
}
