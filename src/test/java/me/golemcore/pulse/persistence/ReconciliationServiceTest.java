package me.golemcore.pulse.persistence;

import me.golemcore.pulse.domain.model.ReconciliationReport;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReconciliationServiceTest {

    private PrimaryBackupRepository repository;
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        repository = mock(PrimaryBackupRepository.class);
        service = new ReconciliationService(repository, new PulseProperties());
    }

    @Test
    void shouldReturnRepositoryReport() {
        ReconciliationReport report = new ReconciliationReport(3, 2, 1, false);
        when(repository.reconcilePending()).thenReturn(report);

        assertEquals(report, service.runPass());
    }

    @Test
    void shouldSurviveFailingPass() {
        when(repository.reconcilePending()).thenThrow(new IllegalStateException("backup unreadable"));

        assertEquals(ReconciliationReport.skipped(), service.runPass());
    }

    @Test
    void shouldSkipWhileAnotherPassIsRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ReconciliationReport report = new ReconciliationReport(1, 1, 0, false);
        when(repository.reconcilePending()).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return report;
        });

        CompletableFuture<ReconciliationReport> first = CompletableFuture.supplyAsync(service::runPass);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertEquals(ReconciliationReport.skipped(), service.runPass());

        release.countDown();
        assertEquals(report, first.get(5, TimeUnit.SECONDS));
    }
}
