package uk.gegc.quizforge.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.quizforge.features.ai.application.PromptTemplateService;
import uk.gegc.quizforge.features.generation.domain.model.CognitiveLevel;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.DistributionPlan;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.Question;
import uk.gegc.quizforge.shared.exception.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    static final String SYSTEM_TEMPLATE = "generation/system.txt";
    static final String CHAIN_OF_THOUGHT_TEMPLATE = "generation/chain-of-thought.txt";
    static final String DISTRIBUTION_PLAN_TEMPLATE = "generation/distribution-plan.txt";
    static final String SINGLE_SCORING_TEMPLATE = "scoring/single.txt";
    static final String QUICK_SCORING_TEMPLATE = "scoring/quick.txt";
    static final String BATCH_SCORING_TEMPLATE = "scoring/batch.txt";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public String buildGenerationPrompt(String content, GenerationOptions options) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Content cannot be empty");
        }
        GenerationOptions resolved = options != null ? options : GenerationOptions.defaults();
        int numQuestions = resolved.numQuestionsOrDefault();

        DistributionPlan plan = resolved.getDistributionPlan();
        if (plan != null && plan.entries().size() > 1) {
            return loadPromptTemplate(DISTRIBUTION_PLAN_TEMPLATE)
                    .replace("{numQuestions}", String.valueOf(numQuestions))
                    .replace("{planTable}", planTable(plan))
                    .replace("{bloomGlossary}", bloomGlossary())
                    .replace("{content}", content);
        }

        CognitiveLevel bloomLevel = resolved.bloomLevelOrDefault();
        Difficulty difficulty = resolved.difficultyOrDefault();
        if (plan != null && plan.entries().size() == 1) {
            bloomLevel = plan.entries().get(0).bloomLevel();
            difficulty = plan.entries().get(0).difficulty();
        }

        return loadPromptTemplate(CHAIN_OF_THOUGHT_TEMPLATE)
                .replace("{bloomLevel}", bloomLevel.getValue())
                .replace("{bloomGuidance}", bloomLevel.getGuidance())
                .replace("{difficultyGuidance}", difficultyGuidance(difficulty))
                .replace("{numQuestions}", String.valueOf(numQuestions))
                .replace("{content}", content);
    }

    @Override
    public String buildSystemPrompt() {
        return loadPromptTemplate(SYSTEM_TEMPLATE).trim();
    }

    @Override
    public String buildScoringPrompt(Question question) {
        return loadPromptTemplate(SINGLE_SCORING_TEMPLATE)
                .replace("{question}", formatQuestion(question));
    }

    @Override
    public String buildQuickScoringPrompt(Question question) {
        return loadPromptTemplate(QUICK_SCORING_TEMPLATE)
                .replace("{question}", formatQuestion(question));
    }

    @Override
    public String buildBatchScoringPrompt(List<Question> questions) {
        StringBuilder block = new StringBuilder();
        for (int i = 0; i < questions.size(); i++) {
            block.append("QUESTION ").append(i).append(":\n")
                    .append(formatQuestion(questions.get(i)))
                    .append("\n\n");
        }
        return loadPromptTemplate(BATCH_SCORING_TEMPLATE)
                .replace("{count}", String.valueOf(questions.size()))
                .replace("{questions}", block.toString().trim());
    }

    @Override
    public String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    String formatQuestion(Question question) {
        StringBuilder formatted = new StringBuilder();
        formatted.append("Question: ").append(question.stem()).append('\n')
                .append("A) ").append(question.optionA()).append('\n')
                .append("B) ").append(question.optionB()).append('\n')
                .append("C) ").append(question.optionC()).append('\n')
                .append("D) ").append(question.optionD()).append('\n')
                .append("Correct Answer: ").append(question.correct()).append('\n');
        if (question.difficulty() != null) {
            formatted.append("Difficulty: ").append(question.difficulty().getValue()).append('\n');
        }
        if (question.rationale() != null) {
            formatted.append("Rationale: ").append(question.rationale()).append('\n');
        }
        return formatted.toString().trim();
    }

    private String difficultyGuidance(Difficulty difficulty) {
        return switch (difficulty) {
            case EASY -> "All questions must be easy: direct application of a single concept stated in the text. "
                    + "Label every question \"easy\".";
            case MEDIUM -> "All questions must be medium: combine two ideas from the text or apply them to a "
                    + "familiar scenario. Label every question \"medium\".";
            case HARD -> "All questions must be hard: multi-step reasoning, unfamiliar scenarios and subtle "
                    + "distractors. Label every question \"hard\".";
            case MIXED -> "Mix difficulties: about 30% easy, 40% medium and 30% hard. "
                    + "Label each question with its actual difficulty.";
        };
    }

    private String planTable(DistributionPlan plan) {
        StringBuilder table = new StringBuilder();
        for (DistributionPlan.Entry entry : plan.entries()) {
            table.append("- ").append(entry.count()).append(" x difficulty=")
                    .append(entry.difficulty().getValue())
                    .append(", cognitive_level=").append(entry.bloomLevel().getValue())
                    .append('\n');
        }
        return table.toString().trim();
    }

    private String bloomGlossary() {
        StringBuilder glossary = new StringBuilder();
        for (CognitiveLevel level : CognitiveLevel.values()) {
            glossary.append("- ").append(level.getValue()).append(": ").append(level.getGuidance()).append('\n');
        }
        return glossary.toString().trim();
    }

    private String loadTemplateFromResources(String templateName) {
        try {
            Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new ConfigurationException("Failed to load prompt template: " + templateName, e);
        }
    }
}
