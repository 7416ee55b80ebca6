package com.phillippitts.swarmcouncil.service.quality;

import com.phillippitts.swarmcouncil.config.properties.CouncilProperties;
import com.phillippitts.swarmcouncil.config.properties.QualityProperties;
import com.phillippitts.swarmcouncil.domain.PipelineRun;
import com.phillippitts.swarmcouncil.exception.CouncilNotReadyException;
import com.phillippitts.swarmcouncil.exception.InvalidRequestException;
import com.phillippitts.swarmcouncil.service.council.AbstractCouncil;
import com.phillippitts.swarmcouncil.service.health.ProviderHealthTracker;
import com.phillippitts.swarmcouncil.service.provider.BoundedProviderFactory;
import com.phillippitts.swarmcouncil.service.provider.ProviderCatalog;
import com.phillippitts.swarmcouncil.service.provider.ProviderDefinition;
import com.phillippitts.swarmcouncil.service.workflow.CancellationToken;
import com.phillippitts.swarmcouncil.service.workflow.WorkflowDefinition;
import com.phillippitts.swarmcouncil.service.workflow.WorkflowPipeline;
import com.phillippitts.swarmcouncil.service.workflow.WorkflowStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.CREATOR;
import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.ENHANCER;
import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.LOCALIZER;
import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.REVIEWER;
import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.VALIDATOR;

/**
 * Quality council: providers join in ascending priority order and produce SEO-structured, scored content.
 *
 * <p>Stage order: creator drafts with the keyword, reviewer restructures for authority and SEO
 * (JSON output), validator checks expertise and attaches schema markup, enhancer broadens coverage,
 * localizer adds local authority. Missing roles are skipped like in the base workflows.
 */
public class QualityCouncil extends AbstractCouncil {

    private static final Logger LOG = LogManager.getLogger(QualityCouncil.class);

    public static final String NAME = "QualityCouncil";
    public static final String WORKFLOW = "quality";
    static final String DEFAULT_CONTENT_TYPE = "article";

    private final WorkflowPipeline pipeline;
    private final SeoStructureParser parser;
    private final ContentScoringEngine scoring;
    private final StructuredMetadataGenerator metadata;
    private final QualityProperties quality;

    public QualityCouncil(ProviderCatalog catalog,
                          BoundedProviderFactory factory,
                          ProviderHealthTracker healthTracker,
                          WorkflowPipeline pipeline,
                          CouncilProperties props,
                          SeoStructureParser parser,
                          ContentScoringEngine scoring,
                          StructuredMetadataGenerator metadata,
                          QualityProperties quality) {
        super(NAME, catalog, factory, healthTracker, props);
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.scoring = Objects.requireNonNull(scoring, "scoring");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.quality = Objects.requireNonNull(quality, "quality");
    }

    @Override
    protected List<ProviderDefinition> orderCandidates(List<ProviderDefinition> candidates) {
        return candidates.stream()
                .sorted(Comparator.comparingInt(ProviderDefinition::priority))
                .toList();
    }

    @Override
    protected List<String> availableWorkflows() {
        return List.of(WORKFLOW);
    }

    public OptimizedContent createOptimizedContent(String prompt, String targetKeyword, String contentType) {
        return createOptimizedContent(prompt, targetKeyword, contentType, defaultToken());
    }

    /**
     * Runs the quality workflow and scores the result.
     *
     * @param prompt        topic prompt
     * @param targetKeyword keyword to optimize for
     * @param contentType   "article" (default when blank) or another type such as "blog"
     * @param token         caller deadline or cancellation signal
     * @return the scored result; provider failures are reported through its status
     * @throws CouncilNotReadyException if the council is not operational
     * @throws InvalidRequestException  if prompt or keyword is blank
     */
    public OptimizedContent createOptimizedContent(String prompt, String targetKeyword, String contentType,
                                                   CancellationToken token) {
        Objects.requireNonNull(token, "token");
        String type = contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType.trim();
        return withMembers(members -> {
            requireText("prompt", prompt, "Invalid prompt: must be a non-empty string");
            requireText("keyword", targetKeyword, "Invalid keyword: must be a non-empty string");

            DraftHolder holder = new DraftHolder();
            PipelineRun run = pipeline.execute(getName(), definition(holder, targetKeyword, type),
                    prompt, members, token);

            ContentDraft finalDraft = run.fallbackContent() != null
                    ? holder.draft.withBody(run.fallbackContent())
                    : holder.draft;
            ScoreResult scores = scoring.score(finalDraft, targetKeyword);
            StructuredMetadata meta = metadata.generate(finalDraft, targetKeyword, type);
            LOG.info("[{}] Quality run for '{}' finished: status={}, qualitative={}, seo={}, combined={}",
                    getName(), targetKeyword, run.status(), scores.overallQualitative(), scores.seoScore(),
                    scores.combinedScore());
            return new OptimizedContent(prompt, targetKeyword, type, run.steps(), finalDraft, scores, meta,
                    run.status(), run.error(), run.fallbackContent(), run.participatingProviders(),
                    run.startedAt(), run.durationMs());
        });
    }

    /**
     * Returns the active scoring thresholds.
     */
    public QualityGuidelines guidelines() {
        QualityProperties.Seo seo = quality.getSeo();
        QualityProperties.Indicators ind = quality.getIndicators();
        Map<String, List<String>> indicators = new LinkedHashMap<>();
        indicators.put("expertise", List.copyOf(ind.getExpertise()));
        indicators.put("experience", List.copyOf(ind.getExperience()));
        indicators.put("authoritativeness", List.copyOf(ind.getAuthoritativeness()));
        indicators.put("trustworthiness", List.copyOf(ind.getTrustworthiness()));
        return new QualityGuidelines(seo.getTitleMinLength(), seo.getTitleMaxLength(),
                seo.getDescriptionMinLength(), seo.getDescriptionMaxLength(),
                seo.getFullLengthWords(), seo.getShortLengthWords(),
                seo.getDensityMin(), seo.getDensityMax(),
                quality.getQualitativeWeight(), quality.getSeoWeight(), indicators);
    }

    private WorkflowDefinition definition(DraftHolder holder, String keyword, String contentType) {
        return new WorkflowDefinition(WORKFLOW, List.of(
                new WorkflowStage(CREATOR,
                        (prompt, buffer) -> QualityPrompts.creator(prompt, keyword),
                        holder::replaceBody),
                new WorkflowStage(REVIEWER,
                        (prompt, buffer) -> QualityPrompts.authorityAndSeo(buffer, keyword),
                        output -> holder.merge(parser.parse(output))),
                new WorkflowStage(VALIDATOR,
                        (prompt, buffer) -> QualityPrompts.expertiseValidation(buffer, keyword),
                        output -> {
                            String body = holder.replaceBody(output);
                            holder.draft = holder.draft.withSchemaMarkup(
                                    metadata.schemaMarkup(holder.draft, keyword, contentType));
                            return body;
                        }),
                new WorkflowStage(ENHANCER,
                        (prompt, buffer) -> QualityPrompts.comprehensiveness(buffer, keyword),
                        holder::replaceBody),
                new WorkflowStage(LOCALIZER,
                        (prompt, buffer) -> QualityPrompts.localAuthority(buffer, keyword),
                        holder::replaceBody)
        ));
    }

    /** Per-run draft, confined to the thread executing the pipeline. */
    private static final class DraftHolder {
        private ContentDraft draft = ContentDraft.ofBody("");

        String replaceBody(String body) {
            draft = draft.withBody(body);
            return draft.body();
        }

        String merge(ContentDraft structured) {
            draft = structured.withSchemaMarkup(draft.schemaMarkup());
            return draft.body();
        }
    }
}
