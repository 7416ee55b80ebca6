package com.phillippitts.swarmcouncil.service.quality;

/**
 * Stage prompts of the quality workflow.
 */
final class QualityPrompts {

    static final int EXCERPT_LENGTH = 1000;

    private QualityPrompts() {}

    static String creator(String topic, String keyword) {
        return String.format("""
                You are the chief E-E-A-T content specialist.

                CONTENT REQUEST
                Topic: "%s"
                Target keyword: "%s"

                EXPERTISE: show deep, accurate technical knowledge and precise terminology.
                EXPERIENCE: include first-hand, practical insights and lessons learned.
                AUTHORITATIVENESS: cite reputable sources and statistics from leading organizations.
                TRUSTWORTHINESS: use verifiable facts, be transparent about sources and add caveats where needed.

                Write at least 1,200 words with a clear structure and headings, ready for a professional CMS.
                """, topic, keyword);
    }

    static String authorityAndSeo(String content, String keyword) {
        return String.format("""
                You are the authority and SEO structure optimizer.

                CONTENT TO ENHANCE:
                "%s"

                TARGET KEYWORD: "%s"

                Strengthen authority with credible references and current statistics.
                Write a compelling title of 30-60 characters that includes the keyword.
                Write a meta description of 120-160 characters with the keyword and a call to action.
                Structure H1, H2 and H3 headings for SEO and keep keyword density between 0.5%% and 2.5%%.

                Respond with JSON only:
                {
                  "title": "...",
                  "metaDescription": "...",
                  "body": "...",
                  "suggestedTags": ["..."],
                  "internalLinks": ["..."],
                  "externalSources": ["..."],
                  "keywordVariations": ["..."],
                  "featuredSnippet": "..."
                }
                """, excerpt(content), keyword);
    }

    static String expertiseValidation(String content, String keyword) {
        return String.format("""
                You are the technical expertise validator.

                CONTENT TO VALIDATE:
                "%s"

                TARGET KEYWORD: "%s"

                Check and correct technical facts, add missing technical detail and expert-level analysis,
                and make the coverage of the topic complete. Return the improved content.
                """, excerpt(content), keyword);
    }

    static String comprehensiveness(String content, String keyword) {
        return String.format("""
                You are the content comprehensiveness enhancer.

                CONTENT TO ENHANCE:
                "%s"

                TARGET KEYWORD: "%s"

                Broaden coverage of related subtopics, add clear examples and answer the questions readers
                are likely to ask next. Do not add inaccurate or misleading information.
                Return the improved content.
                """, excerpt(content), keyword);
    }

    static String localAuthority(String content, String keyword) {
        return String.format("""
                You are the local authority and cultural expert.

                CONTENT TO LOCALIZE:
                "%s"

                TARGET KEYWORD: "%s"

                Add local examples and references from trusted local organizations, adapt the language
                and tone to the local audience and target local search intent.
                Return the improved content.
                """, excerpt(content), keyword);
    }

    /** First {@value #EXCERPT_LENGTH} characters of the content followed by an ellipsis. */
    static String excerpt(String content) {
        String text = content == null ? "" : content;
        return (text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH)) + "...";
    }
}
