package io.github.hotbrkm.autobulk.dispatcher.send;

import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.job.TestJobs;
import io.github.hotbrkm.autobulk.dispatcher.recipient.Recipient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RecipientDispatcher test")
class RecipientDispatcherTest {

    private static final Job JOB = TestJobs.delayedJob(Instant.parse("2024-01-01T10:00:00Z")).build();

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Counts delivered and rejected recipients and lists failures")
    void dispatch_aggregatesOutcomes() {
        DispatchGateway gateway = mock(DispatchGateway.class);
        Recipient ok = Recipient.of("ok@example.com");
        Recipient bad = Recipient.of("bad@example.com");
        when(gateway.send(any(), eq(ok))).thenReturn(DeliveryOutcome.delivered());
        when(gateway.send(any(), eq(bad))).thenReturn(DeliveryOutcome.rejected("550 mailbox unavailable"));
        RecipientDispatcher dispatcher = new RecipientDispatcher(new PassThroughTemplateRenderer(), gateway, executor, 5_000);

        DispatchSummary summary = dispatcher.dispatch(JOB, List.of(ok, bad), Map.of());

        assertThat(summary.attempted()).isEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.errorSummary()).isEqualTo("bad@example.com: REJECTED 550 mailbox unavailable");
    }

    @Test
    @DisplayName("Gateway exception counts as a transient failure of that recipient only")
    void gatewayException_isTransientFailure() {
        DispatchGateway gateway = mock(DispatchGateway.class);
        Recipient ok = Recipient.of("ok@example.com");
        Recipient broken = Recipient.of("broken@example.com");
        when(gateway.send(any(), eq(ok))).thenReturn(DeliveryOutcome.delivered());
        when(gateway.send(any(), eq(broken))).thenThrow(new IllegalStateException("connection reset"));
        RecipientDispatcher dispatcher = new RecipientDispatcher(new PassThroughTemplateRenderer(), gateway, executor, 5_000);

        DispatchSummary summary = dispatcher.dispatch(JOB, List.of(ok, broken), Map.of());

        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.errors()).singleElement().asString()
                .contains("TRANSIENT_ERROR")
                .contains("connection reset");
    }

    @Test
    @DisplayName("Template error rejects the recipient without calling the gateway")
    void templateError_rejectsRecipient() {
        DispatchGateway gateway = mock(DispatchGateway.class);
        TemplateRenderer renderer = mock(TemplateRenderer.class);
        when(renderer.render(any(), any())).thenThrow(new TemplateException("missing variable 'first_name'"));
        RecipientDispatcher dispatcher = new RecipientDispatcher(renderer, gateway, executor, 5_000);

        DispatchSummary summary = dispatcher.dispatch(JOB, List.of(Recipient.of("a@example.com")), Map.of());

        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.errorSummary()).contains("REJECTED").contains("first_name");
        verify(gateway, never()).send(any(), any());
    }

    @Test
    @DisplayName("Recipients still running at the deadline are cancelled and counted as failed")
    void slowRecipient_timesOut() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        DispatchGateway gateway = (message, recipient) -> {
            if (recipient.email().startsWith("slow")) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return DeliveryOutcome.delivered();
        };
        RecipientDispatcher dispatcher = new RecipientDispatcher(new PassThroughTemplateRenderer(), gateway, executor, 200);

        DispatchSummary summary = dispatcher.dispatch(JOB,
                List.of(Recipient.of("fast@example.com"), Recipient.of("slow@example.com")), Map.of());
        release.countDown();

        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.errorSummary()).startsWith("slow@example.com: TRANSIENT_ERROR Timed out");
    }

    @Test
    @DisplayName("Renderer receives context, recipient attributes and the address")
    void renderer_receivesMergedVariables() {
        TemplateRenderer renderer = mock(TemplateRenderer.class);
        when(renderer.render(any(), any())).thenAnswer(invocation ->
                new RenderedMessage(invocation.getArgument(0), invocation.getArgument(1)));
        DispatchGateway gateway = mock(DispatchGateway.class);
        when(gateway.send(any(), any())).thenReturn(DeliveryOutcome.delivered());
        RecipientDispatcher dispatcher = new RecipientDispatcher(renderer, gateway, executor, 5_000);

        Recipient recipient = new Recipient("kim@example.com", Map.of("first_name", "Kim", "attempt", "override"));
        dispatcher.dispatch(JOB, List.of(recipient), Map.of("job_id", JOB.getId(), "attempt", "1"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> variables = ArgumentCaptor.forClass(Map.class);
        verify(renderer).render(eq(JOB.getTemplateRef()), variables.capture());
        assertThat(variables.getValue())
                .containsEntry("job_id", JOB.getId())
                .containsEntry("first_name", "Kim")
                .containsEntry("attempt", "override")
                .containsEntry("email", "kim@example.com");
    }

    @Test
    @DisplayName("No recipients yields an empty summary")
    void noRecipients_yieldsEmptySummary() {
        RecipientDispatcher dispatcher = new RecipientDispatcher(new PassThroughTemplateRenderer(),
                mock(DispatchGateway.class), executor, 5_000);

        assertThat(dispatcher.dispatch(JOB, List.of(), Map.of())).isEqualTo(DispatchSummary.empty());
    }
}
