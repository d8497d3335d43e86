package uk.gegc.quizforge.features.ai.infra.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.quizforge.features.generation.domain.model.AnswerLetter;
import uk.gegc.quizforge.features.generation.domain.model.CognitiveLevel;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.Question;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.shared.exception.AIResponseParseException;
import uk.gegc.quizforge.shared.exception.QuestionValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Component
@Slf4j
public class QuestionResponseParserImpl implements QuestionResponseParser {

    private static final String[] STEM_KEYS = {"questiontext", "questionText", "question", "text", "stem"};
    private static final String[] ANSWER_KEYS = {"correctanswer", "correctAnswer", "correct_answer", "answer", "correct"};
    private static final String[] DIFFICULTY_KEYS = {"difficulty", "level"};
    private static final String[] COGNITIVE_KEYS = {"cognitive_level", "cognitiveLevel", "bloom_level", "bloomLevel"};
    private static final String[] RATIONALE_KEYS = {"rationale", "explanation"};

    private final QuestionJsonRecovery recovery;

    public QuestionResponseParserImpl(ObjectMapper objectMapper) {
        this.recovery = new QuestionJsonRecovery(objectMapper);
    }

    @Override
    public QuestionSet parseQuestionSet(String rawResponse, GenerationOptions options) {
        GenerationOptions resolved = options != null ? options : GenerationOptions.defaults();
        JsonNode root = recovery.parse(rawResponse);
        JsonNode array = root.isArray() ? root : root.path("questions");
        if (!array.isArray()) {
            throw new AIResponseParseException("Invalid response format: expected a 'questions' array");
        }

        List<Question> questions = new ArrayList<>();
        String firstProblem = null;
        for (int i = 0; i < array.size(); i++) {
            try {
                questions.add(standardize(array.get(i), i, resolved));
            } catch (QuestionValidationException e) {
                log.warn("Dropping invalid question from provider response: {}", e.getMessage());
                if (firstProblem == null) {
                    firstProblem = e.getMessage();
                }
            }
        }

        if (questions.isEmpty()) {
            throw new QuestionValidationException("No valid questions in provider response"
                    + (firstProblem != null ? " (" + firstProblem + ")" : ""));
        }

        int requested = resolved.numQuestionsOrDefault();
        if (questions.size() > requested) {
            questions = new ArrayList<>(questions.subList(0, requested));
        }

        String analysis = root.isObject() ? text(root.get("analysis")) : null;
        log.debug("Parsed {} questions ({} in response)", questions.size(), array.size());
        return QuestionSet.builder()
                .questions(questions)
                .analysis(analysis)
                .build();
    }

    @Override
    public JsonNode parseJson(String rawResponse) {
        return recovery.parse(rawResponse);
    }

    /**
     * Maps one question object in any of the accepted shapes onto {@link Question}.
     */
    Question standardize(JsonNode node, int index, GenerationOptions options) {
        String label = "Question " + (index + 1);
        if (node == null || !node.isObject()) {
            throw new QuestionValidationException(label + " is not an object");
        }

        String stem = firstText(node, STEM_KEYS)
                .orElseThrow(() -> new QuestionValidationException(label + " missing required field: questiontext"));

        List<String> choiceTexts = new ArrayList<>(4);
        for (AnswerLetter letter : AnswerLetter.values()) {
            String option = option(node, letter)
                    .orElseThrow(() -> new QuestionValidationException(
                            label + " missing required field: option" + letter.name().toLowerCase(Locale.ROOT)));
            choiceTexts.add(option);
        }
        Set<String> distinct = new HashSet<>();
        for (String option : choiceTexts) {
            if (!distinct.add(option.toLowerCase(Locale.ROOT))) {
                throw new QuestionValidationException(label + " has duplicate options");
            }
        }

        String rawAnswer = firstText(node, ANSWER_KEYS)
                .orElseThrow(() -> new QuestionValidationException(label + " missing required field: correctanswer"));
        AnswerLetter correct = AnswerLetter.parse(rawAnswer)
                .or(() -> matchOptionText(rawAnswer, choiceTexts))
                .orElseThrow(() -> new QuestionValidationException(
                        label + " has invalid correct answer: " + rawAnswer));

        Difficulty difficulty = firstText(node, DIFFICULTY_KEYS)
                .flatMap(Difficulty::parse)
                .filter(Difficulty::isConcrete)
                .orElse(Difficulty.MEDIUM);

        CognitiveLevel cognitiveLevel = firstText(node, COGNITIVE_KEYS)
                .flatMap(CognitiveLevel::parse)
                .orElse(options.bloomLevelOrDefault());

        return Question.builder()
                .stem(stem)
                .optionA(choiceTexts.get(0))
                .optionB(choiceTexts.get(1))
                .optionC(choiceTexts.get(2))
                .optionD(choiceTexts.get(3))
                .correct(correct)
                .difficulty(difficulty)
                .cognitiveLevel(cognitiveLevel)
                .rationale(firstText(node, RATIONALE_KEYS).orElse(null))
                .build();
    }

    private Optional<String> option(JsonNode node, AnswerLetter letter) {
        String upper = letter.name();
        String lower = upper.toLowerCase(Locale.ROOT);
        Optional<String> flat = firstText(node, "option" + lower, "option" + upper, "option_" + lower, upper, lower);
        if (flat.isPresent()) {
            return flat;
        }
        JsonNode nested = node.get("options");
        if (nested == null) {
            nested = node.get("choices");
        }
        if (nested == null) {
            return Optional.empty();
        }
        if (nested.isObject()) {
            return firstText(nested, upper, lower);
        }
        if (nested.isArray() && nested.size() > letter.index()) {
            return Optional.ofNullable(text(nested.get(letter.index())))
                    .map(this::stripLetterPrefix);
        }
        return Optional.empty();
    }

    private String stripLetterPrefix(String option) {
        if (option.length() > 2 && "ABCDabcd".indexOf(option.charAt(0)) >= 0
                && (option.charAt(1) == ')' || option.charAt(1) == '.')) {
            return option.substring(2).trim();
        }
        return option;
    }

    private static Optional<AnswerLetter> matchOptionText(String answer, List<String> options) {
        String normalized = answer.trim();
        for (int i = 0; i < options.size(); i++) {
            if (options.get(i).equalsIgnoreCase(normalized)) {
                return Optional.of(AnswerLetter.values()[i]);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstText(JsonNode node, String... keys) {
        for (String key : keys) {
            String value = text(node.get(key));
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
