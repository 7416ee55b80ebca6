package com.phillippitts.swarmcouncil.service.council;

import com.phillippitts.swarmcouncil.domain.PipelineRun;
import com.phillippitts.swarmcouncil.domain.RunStatus;
import com.phillippitts.swarmcouncil.domain.StepRecord;
import com.phillippitts.swarmcouncil.service.workflow.CancellationToken;
import com.phillippitts.swarmcouncil.testutil.CouncilFixture;
import com.phillippitts.swarmcouncil.testutil.FakeContentProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SwarmCouncilConcurrencyTest {

    private static final String PROMPT = "Write about Thai tea";

    private ExecutorService executor;
    private ScheduledExecutorService canceller;
    private CouncilFixture fixture;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        canceller = Executors.newSingleThreadScheduledExecutor();
        fixture = new CouncilFixture().standardMembers();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        canceller.shutdownNow();
    }

    @Test
    void cancelledTokenFailsBeforeAnyProviderCall() {
        SwarmCouncil council = fixture.swarmCouncil(executor);
        council.initialize();
        CancellationToken token = CancellationToken.manual();
        token.cancel();

        PipelineRun run = council.executeWorkflow(PROMPT, "full", token);

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.error()).isEqualTo("Workflow cancelled");
        assertThat(run.steps()).isEmpty();
        assertThat(run.fallbackContent()).isNull();
        assertThat(fixture.provider("gemini").calls()).isZero();
    }

    @Test
    void deadlineDuringStageFailsWithoutDegradation() {
        fixture.provider("gemini").delayMs = 3_000;
        SwarmCouncil council = fixture.swarmCouncil(executor);
        council.initialize();

        PipelineRun run = council.executeWorkflow(PROMPT, "full", CancellationToken.withTimeout(Duration.ofMillis(200)));

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.error()).isEqualTo("Workflow deadline exceeded");
        assertThat(run.fallbackContent()).isNull();
        assertThat(run.durationMs()).isLessThan(3_000);
        assertThat(fixture.provider("openai").calls()).isZero();
    }

    @Test
    void cancellationKeepsCommittedSteps() {
        fixture.provider("openai").delayMs = 3_000;
        SwarmCouncil council = fixture.swarmCouncil(executor);
        council.initialize();
        CancellationToken token = CancellationToken.manual();
        canceller.schedule(token::cancel, 300, TimeUnit.MILLISECONDS);

        PipelineRun run = council.executeWorkflow(PROMPT, "full", token);

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.error()).isEqualTo("Workflow cancelled");
        assertThat(run.steps()).extracting(StepRecord::role).containsExactly("creator");
        assertThat(run.currentContent()).isEqualTo("gemini-output");
    }

    @Test
    void reinitializeNeverLeaksStaleProviderHandles() throws Exception {
        CouncilFixture fresh = new CouncilFixture();
        for (Map.Entry<String, String> member : Map.of(
                "gemini", "creator", "openai", "reviewer", "claude", "enhancer").entrySet()) {
            String id = member.getKey();
            fresh.catalog.add(id, member.getValue());
            fresh.registry.register(id, () -> {
                FakeContentProvider p = FakeContentProvider.full(id, id + "-output");
                p.delayMs = 2;
                return p;
            });
        }
        SwarmCouncil council = fresh.swarmCouncil();
        council.initialize();

        List<Future<List<PipelineRun>>> workers = new ArrayList<>();
        for (int w = 0; w < 4; w++) {
            workers.add(executor.submit(() -> {
                List<PipelineRun> runs = new ArrayList<>();
                for (int i = 0; i < 20; i++) {
                    runs.add(council.executeWorkflow(PROMPT, "full"));
                }
                return runs;
            }));
        }
        for (int i = 0; i < 10; i++) {
            council.reinitialize();
        }

        List<PipelineRun> runs = new ArrayList<>();
        for (Future<List<PipelineRun>> worker : workers) {
            runs.addAll(worker.get(30, TimeUnit.SECONDS));
        }
        Map<String, String> assignments = council.status().roleAssignments();
        assertThat(runs).hasSize(80).allSatisfy(run -> {
            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(run.steps()).allSatisfy(step ->
                    assertThat(assignments.values()).contains(step.providerId()));
        });
        assertThat(fresh.registry.constructionCount("gemini")).isEqualTo(11);
    }
}
