package uk.gegc.quizforge.features.generation.application.quality;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizforge.features.ai.application.PromptTemplateService;
import uk.gegc.quizforge.features.ai.application.ProviderRouter;
import uk.gegc.quizforge.features.ai.infra.parser.QuestionResponseParser;
import uk.gegc.quizforge.features.generation.config.GenerationProperties;
import uk.gegc.quizforge.features.generation.domain.model.Question;
import uk.gegc.quizforge.shared.exception.AIResponseParseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Scores questions against a rubric with an LLM and regenerates the rejected ones.
 *
 * <p>Scoring is best effort: any failure to obtain or read a score accepts the question
 * as skipped with the minimum score.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QualityScorer {

    private final GenerationProperties properties;
    private final ProviderRouter providerRouter;
    private final PromptTemplateService promptTemplateService;
    private final QuestionResponseParser responseParser;

    public boolean isEnabled() {
        return properties.getQuality().isEnabled();
    }

    /**
     * Scores in batches of the configured size; a batch that fails is scored question by question.
     */
    public List<QuestionScore> scoreQuestions(List<Question> questions) {
        int batchSize = Math.max(1, properties.getQuality().getBatchSize());
        List<QuestionScore> scores = new ArrayList<>(questions.size());
        for (int from = 0; from < questions.size(); from += batchSize) {
            List<Question> batch = questions.subList(from, Math.min(from + batchSize, questions.size()));
            scores.addAll(batch.size() == 1 ? List.of(scoreQuestion(batch.get(0))) : scoreBatch(batch));
        }
        return scores;
    }

    public QuestionScore scoreQuestion(Question question) {
        GenerationProperties.Quality quality = properties.getQuality();
        String prompt = quality.isUseQuickScore()
                ? promptTemplateService.buildQuickScoringPrompt(question)
                : promptTemplateService.buildScoringPrompt(question);
        try {
            JsonNode node = responseParser.parseJson(providerRouter.complete(quality.getScorerProvider(), prompt));
            return readScore(node);
        } catch (RuntimeException e) {
            log.warn("Scoring failed, accepting question as skipped: {}", e.getMessage());
            return QuestionScore.skipped(quality.getMinScore(), e.getMessage());
        }
    }

    /**
     * Scores, keeps accepted and needs-revision questions in their original order and
     * replaces rejected ones through {@code regenerateFn} while attempts remain. Improved
     * questions are appended after the kept ones.
     *
     * @param regenerateFn produces the given number of fresh questions, may be null
     */
    public ScoringResult scoreAndImprove(List<Question> questions, IntFunction<List<Question>> regenerateFn) {
        GenerationProperties.Quality quality = properties.getQuality();
        List<QuestionScore> allScores = new ArrayList<>();
        Map<Question, Double> scoreByQuestion = new HashMap<>();

        List<Question> accepted = new ArrayList<>();
        List<Question> needsRevision = new ArrayList<>();
        List<Question> rejected = new ArrayList<>();
        List<QuestionScore> initialScores = scoreQuestions(questions);
        classify(questions, initialScores, accepted, needsRevision, rejected, allScores, scoreByQuestion);
        int initiallyRejected = rejected.size();

        List<Question> improved = new ArrayList<>();
        int attempts = 0;
        String regenerationError = null;
        int outstanding = rejected.size();
        while (outstanding > 0 && regenerateFn != null && attempts < quality.getMaxRetries()) {
            attempts++;
            log.info("Regenerating {} rejected questions (attempt {}/{})", outstanding, attempts, quality.getMaxRetries());
            List<Question> regenerated;
            try {
                regenerated = regenerateFn.apply(outstanding);
            } catch (RuntimeException e) {
                log.warn("Regeneration of rejected questions failed: {}", e.getMessage());
                regenerationError = e.getMessage();
                break;
            }
            if (regenerated.size() > outstanding) {
                regenerated = regenerated.subList(0, outstanding);
            }
            List<Question> stillRejected = new ArrayList<>();
            classify(regenerated, scoreQuestions(regenerated), improved, improved, stillRejected, allScores, scoreByQuestion);
            outstanding = outstanding - regenerated.size() + stillRejected.size();
        }

        List<Question> kept = new ArrayList<>(accepted.size() + needsRevision.size() + improved.size());
        for (int i = 0; i < questions.size(); i++) {
            if (initialScores.get(i).decision() != ScoreDecision.REJECT) {
                kept.add(questions.get(i));
            }
        }
        kept.addAll(improved);
        if (kept.isEmpty() && !questions.isEmpty()) {
            log.warn("All {} questions were rejected and none could be replaced; keeping the originals", questions.size());
            kept.addAll(questions);
        }

        ScoreStatistics statistics = ScoreStatistics.of(allScores, quality.getMinScore());
        log.info("Quality scoring: {} accepted, {} need revision, {} rejected, {} improved (avg {})",
                accepted.size(), needsRevision.size(), initiallyRejected, improved.size(), statistics.average());

        Map<Question, Double> keptScores = new LinkedHashMap<>();
        for (Question question : kept) {
            Double score = scoreByQuestion.get(question);
            if (score != null) {
                keptScores.put(question, score);
            }
        }
        return new ScoringResult(kept, keptScores, accepted.size(), needsRevision.size(), initiallyRejected,
                improved.size(), attempts, statistics, regenerationError);
    }

    private void classify(List<Question> questions, List<QuestionScore> scores,
                          List<Question> accepted, List<Question> needsRevision, List<Question> rejected,
                          List<QuestionScore> allScores, Map<Question, Double> scoreByQuestion) {
        for (int i = 0; i < questions.size(); i++) {
            Question question = questions.get(i);
            QuestionScore score = scores.get(i);
            allScores.add(score);
            scoreByQuestion.put(question, score.score());
            switch (score.decision()) {
                case ACCEPT -> accepted.add(question);
                case NEEDS_REVISION -> needsRevision.add(question);
                case REJECT -> rejected.add(question);
            }
        }
    }

    private List<QuestionScore> scoreBatch(List<Question> batch) {
        try {
            String completion = providerRouter.complete(properties.getQuality().getScorerProvider(),
                    promptTemplateService.buildBatchScoringPrompt(batch));
            JsonNode scoresNode = responseParser.parseJson(completion).path("scores");
            if (!scoresNode.isArray()) {
                throw new AIResponseParseException("Batch scoring response has no 'scores' array");
            }
            QuestionScore[] scores = new QuestionScore[batch.size()];
            for (int i = 0; i < scoresNode.size(); i++) {
                JsonNode node = scoresNode.get(i);
                int index = node.has("questionIndex") ? node.get("questionIndex").asInt(-1) : i;
                if (index >= 0 && index < scores.length && scores[index] == null) {
                    scores[index] = readScore(node);
                }
            }
            List<QuestionScore> result = new ArrayList<>(batch.size());
            for (int i = 0; i < scores.length; i++) {
                result.add(scores[i] != null ? scores[i] : scoreQuestion(batch.get(i)));
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Batch scoring of {} questions failed, scoring individually: {}", batch.size(), e.getMessage());
            return batch.stream().map(this::scoreQuestion).toList();
        }
    }

    private QuestionScore readScore(JsonNode node) {
        JsonNode scoreNode = node.get("score");
        double raw = scoreNode == null || !scoreNode.isValueNode() ? Double.NaN : scoreNode.asDouble(Double.NaN);
        if (Double.isNaN(raw)) {
            throw new AIResponseParseException("Scoring response has no numeric 'score'");
        }
        double score = Math.max(0.0, Math.min(10.0, raw));
        String recommendation = node.hasNonNull("recommendation")
                ? node.get("recommendation").asText().trim().toLowerCase(Locale.ROOT)
                : null;
        return new QuestionScore(score,
                optionalInt(node, "clarity"),
                optionalInt(node, "distractors"),
                optionalInt(node, "relevance"),
                optionalInt(node, "correctness"),
                textList(node.get("issues")),
                textList(node.get("strengths")),
                recommendation,
                false,
                null);
    }

    private static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        });
        return values;
    }
}
