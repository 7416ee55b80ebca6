package com.phillippitts.swarmcouncil.service.council;

import com.phillippitts.swarmcouncil.domain.PipelineRun;
import com.phillippitts.swarmcouncil.domain.RunStatus;
import com.phillippitts.swarmcouncil.domain.StepRecord;
import com.phillippitts.swarmcouncil.exception.InvalidRequestException;
import com.phillippitts.swarmcouncil.exception.ProviderException;
import com.phillippitts.swarmcouncil.service.fallback.event.AllFallbacksFailedEvent;
import com.phillippitts.swarmcouncil.service.fallback.event.FallbackAttemptFailedEvent;
import com.phillippitts.swarmcouncil.service.workflow.CouncilRoles;
import com.phillippitts.swarmcouncil.testutil.CouncilFixture;
import com.phillippitts.swarmcouncil.testutil.FakeContentProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SwarmCouncilWorkflowTest {

    private static final String PROMPT = "Write about Thai tea";
    private static final String FALLBACK_PROMPT = PROMPT + "\n\n[Fallback mode - simple response requested]";

    private CouncilFixture fixture;
    private SwarmCouncil council;

    @BeforeEach
    void setUp() {
        fixture = new CouncilFixture().standardMembers();
        council = fixture.swarmCouncil();
        council.initialize();
    }

    @Test
    void fullWorkflowRunsEveryRoleInOrder() {
        PipelineRun run = council.executeWorkflow(PROMPT, "full");

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.steps()).extracting(StepRecord::role)
                .containsExactly("creator", "reviewer", "enhancer", "validator", "localizer");
        assertThat(run.steps()).extracting(StepRecord::providerId)
                .containsExactly("gemini", "openai", "claude", "deepseek", "chinda");
        assertThat(run.steps()).extracting(StepRecord::stepIndex).containsExactly(1, 2, 3, 4, 5);
        assertThat(run.currentContent()).isEqualTo(run.steps().get(4).outputContent()).isEqualTo("chinda-output");
        assertThat(run.workflowName()).isEqualTo("full");
        assertThat(run.error()).isNull();
        assertThat(run.fallbackContent()).isNull();
        assertThat(run.participatingProviders()).containsExactly("gemini", "openai", "claude", "deepseek", "chinda");
    }

    @Test
    void eachStageRefinesThePreviousOutput() {
        council.executeWorkflow(PROMPT, "full");

        assertThat(fixture.provider("gemini").prompts())
                .containsExactly(PROMPT + "\n\nRole: " + CouncilRoles.describe("creator"));
        assertThat(fixture.provider("openai").prompts()).containsExactly(
                "Please review and improve the quality of the following content:\n\ngemini-output\n\nRole: "
                        + CouncilRoles.describe("reviewer"));
        assertThat(fixture.provider("claude").prompts().get(0)).contains("\n\nopenai-output\n\n");
        assertThat(fixture.provider("deepseek").prompts().get(0)).contains("\n\nclaude-output\n\n");
        assertThat(fixture.provider("chinda").prompts().get(0)).contains("\n\ndeepseek-output\n\n");
    }

    @Test
    void skipsRoleWithoutProviderAndPassesBufferThrough() {
        CouncilFixture partial = new CouncilFixture();
        partial.member("gemini", "creator");
        partial.member("openai", "reviewer");
        partial.member("claude", "enhancer");
        partial.member("chinda", "localizer");
        SwarmCouncil council = partial.swarmCouncil();
        council.initialize();

        PipelineRun run = council.executeWorkflow(PROMPT, "full");

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.steps()).extracting(StepRecord::role)
                .containsExactly("creator", "reviewer", "enhancer", "localizer");
        assertThat(run.steps()).extracting(StepRecord::stepIndex).containsExactly(1, 2, 3, 5);
        assertThat(partial.provider("chinda").prompts().get(0)).contains("\n\nclaude-output\n\n");
    }

    @Test
    void emptyOutputSkipsRemainingStages() {
        fixture.provider("gemini").thenReturn("");

        PipelineRun run = council.executeWorkflow(PROMPT, "full");

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.steps()).singleElement().satisfies(step -> {
            assertThat(step.role()).isEqualTo("creator");
            assertThat(step.outputContent()).isEmpty();
        });
        assertThat(fixture.provider("openai").calls()).isZero();
        assertThat(fixture.provider("chinda").calls()).isZero();
    }

    @Test
    void workflowWithNoAssignedRoleCompletesWithoutContent() {
        CouncilFixture creatorsOnly = new CouncilFixture();
        creatorsOnly.member("gemini", "creator");
        SwarmCouncil council = creatorsOnly.swarmCouncil();
        council.initialize();

        PipelineRun run = council.executeWorkflow(PROMPT, "review");

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.steps()).isEmpty();
        assertThat(run.currentContent()).isNull();
        assertThat(creatorsOnly.provider("gemini").calls()).isZero();
    }

    @Test
    void singleStageWorkflowsUseTheirRoleOnThePrompt() {
        PipelineRun create = council.executeWorkflow(PROMPT, "create");
        PipelineRun review = council.executeWorkflow("Draft text to review", "review");
        PipelineRun optimize = council.executeWorkflow("Draft text to optimize", "OPTIMIZE");

        assertThat(create.steps()).extracting(StepRecord::providerId).containsExactly("gemini");
        assertThat(review.steps()).extracting(StepRecord::providerId).containsExactly("openai");
        assertThat(optimize.steps()).extracting(StepRecord::providerId).containsExactly("claude");
        assertThat(optimize.workflowName()).isEqualTo("optimize");
        assertThat(fixture.provider("openai").prompts().get(0)).startsWith("Draft text to review\n\nRole: ");
        assertThat(fixture.provider("claude").prompts().get(0)).startsWith("Draft text to optimize\n\nRole: ");
    }

    @Test
    void degradesToFirstWorkingProviderWhenStageFails() {
        fixture.provider("openai").failing = true;

        PipelineRun run = council.executeWorkflow(PROMPT, "full");

        assertThat(run.status()).isEqualTo(RunStatus.DEGRADED);
        assertThat(run.isDegraded()).isTrue();
        assertThat(run.steps()).extracting(StepRecord::role).containsExactly("creator");
        assertThat(run.currentContent()).isEqualTo("gemini-output");
        assertThat(run.fallbackContent()).isEqualTo("gemini-output");
        assertThat(run.fallbackProviderId()).isEqualTo("gemini");
        assertThat(run.effectiveContent()).isEqualTo("gemini-output");
        assertThat(run.error()).contains("Stage 2 (reviewer via openai)");
        assertThat(fixture.provider("gemini").prompts()).last().isEqualTo(FALLBACK_PROMPT);
        assertThat(fixture.provider("claude").calls()).isZero();
    }

    @Test
    void fallbackWalksMembersInRegistrationOrder() {
        fixture.provider("gemini").failWhen = prompt -> prompt.equals(FALLBACK_PROMPT);
        fixture.provider("openai").failing = true;

        PipelineRun run = council.executeWorkflow(PROMPT, "full");

        assertThat(run.status()).isEqualTo(RunStatus.DEGRADED);
        assertThat(run.fallbackProviderId()).isEqualTo("claude");
        assertThat(run.fallbackContent()).isEqualTo("claude-output");
        assertThat(fixture.publisher.eventsOf(FallbackAttemptFailedEvent.class))
                .extracting(FallbackAttemptFailedEvent::providerId)
                .containsExactly("gemini", "openai");
    }

    @Test
    void failsWithSentinelWhenEveryFallbackFails() {
        for (String id : new String[]{"gemini", "openai", "claude", "deepseek", "chinda"}) {
            fixture.provider(id).failing = true;
        }

        PipelineRun run = council.executeWorkflow(PROMPT, "full");

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.steps()).isEmpty();
        assertThat(run.fallbackContent()).isEqualTo("Unable to generate content - all providers failed");
        assertThat(run.fallbackProviderId()).isNull();
        assertThat(fixture.publisher.eventsOf(AllFallbacksFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.attempted()).isEqualTo(5));
    }

    @Test
    void countsWorkflowOutcomes() {
        council.executeWorkflow(PROMPT, "full");
        council.executeWorkflow(PROMPT, "full");

        double completed = fixture.meterRegistry.get("council.workflow.outcome")
                .tag("workflow", "full")
                .tag("status", "completed")
                .counter()
                .count();
        assertThat(completed).isEqualTo(2.0);
    }

    @Test
    void rejectsBlankPrompt() {
        assertThatThrownBy(() -> council.executeWorkflow("   ", "full"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Invalid prompt: must be a non-empty string");
        assertThat(fixture.provider("gemini").calls()).isZero();
    }

    @Test
    void rejectsUnknownWorkflowListingValidNames() {
        assertThatThrownBy(() -> council.executeWorkflow(PROMPT, "translate"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Unknown workflow: translate. Available workflows: full, create, review, optimize");
    }

    @Test
    void consultReturnsRawAnswerOfRoleHolder() {
        String answer = council.consult("validator", "Is this accurate?");

        assertThat(answer).isEqualTo("deepseek-output");
        assertThat(fixture.provider("deepseek").prompts()).containsExactly("Is this accurate?");
    }

    @Test
    void consultRejectsUnknownRole() {
        assertThatThrownBy(() -> council.consult("translator", "Hello"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("No member found with role: translator");
    }

    @Test
    void consultValidatesArguments() {
        assertThatThrownBy(() -> council.consult("", "Hello"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Invalid role: must be a non-empty string");
        assertThatThrownBy(() -> council.consult("creator", null))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Invalid question: must be a non-empty string");
    }

    @Test
    void consultPropagatesProviderFailure() {
        FakeContentProvider gemini = fixture.provider("gemini");
        gemini.failing = true;

        assertThatThrownBy(() -> council.consult("creator", "Hello"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("gemini");
    }
}
