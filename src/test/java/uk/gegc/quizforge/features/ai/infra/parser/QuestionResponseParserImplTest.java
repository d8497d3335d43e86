package uk.gegc.quizforge.features.ai.infra.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.quizforge.features.generation.domain.model.AnswerLetter;
import uk.gegc.quizforge.features.generation.domain.model.CognitiveLevel;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.Question;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.shared.exception.AIResponseParseException;
import uk.gegc.quizforge.shared.exception.QuestionValidationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QuestionResponseParserImpl")
class QuestionResponseParserImplTest {

    private final QuestionResponseParserImpl parser = new QuestionResponseParserImpl(new ObjectMapper());

    private static final String VALID = """
            {"questiontext": "What is 2 + 2?", "optiona": "3", "optionb": "4", "optionc": "5", "optiond": "6",
             "correctanswer": "B", "difficulty": "easy", "cognitive_level": "remember", "rationale": "Arithmetic."}
            """;

    @Nested
    @DisplayName("parseQuestionSet")
    class ParseQuestionSet {

        @Test
        @DisplayName("maps the canonical flat shape and keeps the analysis")
        void canonicalShape() {
            // Given
            String raw = "{\"analysis\": \"Basic maths\", \"questions\": [" + VALID + "]}";

            // When
            QuestionSet set = parser.parseQuestionSet(raw, GenerationOptions.defaults());

            // Then
            assertThat(set.getAnalysis()).isEqualTo("Basic maths");
            assertThat(set.getQuestions()).singleElement().satisfies(q -> {
                assertThat(q.stem()).isEqualTo("What is 2 + 2?");
                assertThat(q.correct()).isEqualTo(AnswerLetter.B);
                assertThat(q.correctOption()).isEqualTo("4");
                assertThat(q.difficulty()).isEqualTo(Difficulty.EASY);
                assertThat(q.cognitiveLevel()).isEqualTo(CognitiveLevel.REMEMBER);
                assertThat(q.rationale()).isEqualTo("Arithmetic.");
            });
        }

        @Test
        @DisplayName("accepts alternate keys, nested option arrays and answers given as option text")
        void alternateShapes() {
            // Given
            String raw = """
                    [{"question": "Capital of France?",
                      "options": ["A) Paris", "B) Rome", "C) Madrid", "D) Berlin"],
                      "correct_answer": "Paris",
                      "level": "HARD",
                      "bloomLevel": "analyze",
                      "explanation": "Paris is the capital."}]
                    """;

            // When
            QuestionSet set = parser.parseQuestionSet(raw, GenerationOptions.defaults());

            // Then
            Question question = set.getQuestions().get(0);
            assertThat(question.optionA()).isEqualTo("Paris");
            assertThat(question.optionD()).isEqualTo("Berlin");
            assertThat(question.correct()).isEqualTo(AnswerLetter.A);
            assertThat(question.difficulty()).isEqualTo(Difficulty.HARD);
            assertThat(question.cognitiveLevel()).isEqualTo(CognitiveLevel.ANALYZE);
            assertThat(question.rationale()).isEqualTo("Paris is the capital.");
        }

        @Test
        @DisplayName("defaults unknown difficulty to medium and unknown level to the requested bloom level")
        void unknownLabelsFallBack() {
            // Given
            String raw = """
                    {"questions": [{"questiontext": "Pick one", "optiona": "w", "optionb": "x", "optionc": "y",
                      "optiond": "z", "correctanswer": "d", "difficulty": "brutal", "cognitive_level": "vibes"}]}
                    """;
            GenerationOptions options = GenerationOptions.builder().bloomLevel(CognitiveLevel.EVALUATE).build();

            // When
            Question question = parser.parseQuestionSet(raw, options).getQuestions().get(0);

            // Then
            assertThat(question.difficulty()).isEqualTo(Difficulty.MEDIUM);
            assertThat(question.cognitiveLevel()).isEqualTo(CognitiveLevel.EVALUATE);
            assertThat(question.correct()).isEqualTo(AnswerLetter.D);
        }

        @Test
        @DisplayName("drops invalid questions and keeps the valid ones")
        void dropsInvalidQuestions() {
            // Given
            String missingOption = """
                    {"questiontext": "Incomplete", "optiona": "a", "optionb": "b", "optionc": "c", "correctanswer": "A"}
                    """;
            String duplicateOptions = """
                    {"questiontext": "Dupes", "optiona": "same", "optionb": "Same", "optionc": "c", "optiond": "d",
                     "correctanswer": "A"}
                    """;
            String badAnswer = """
                    {"questiontext": "Bad answer", "optiona": "a", "optionb": "b", "optionc": "c", "optiond": "d",
                     "correctanswer": "E"}
                    """;
            String raw = "{\"questions\": [" + missingOption + "," + VALID + "," + duplicateOptions + "," + badAnswer + "]}";

            // When
            QuestionSet set = parser.parseQuestionSet(raw, GenerationOptions.defaults());

            // Then
            assertThat(set.getQuestions()).extracting(Question::stem).containsExactly("What is 2 + 2?");
        }

        @Test
        @DisplayName("throws when no question survives validation")
        void noValidQuestionsThrows() {
            String raw = "{\"questions\": [{\"questiontext\": \"Only a stem\"}]}";

            assertThatThrownBy(() -> parser.parseQuestionSet(raw, GenerationOptions.defaults()))
                    .isInstanceOf(QuestionValidationException.class)
                    .hasMessageContaining("No valid questions")
                    .hasMessageContaining("optiona");
        }

        @Test
        @DisplayName("throws when the payload has no questions array")
        void missingArrayThrows() {
            assertThatThrownBy(() -> parser.parseQuestionSet("{\"items\": {}}", GenerationOptions.defaults()))
                    .isInstanceOf(AIResponseParseException.class)
                    .hasMessageContaining("questions");
        }

        @Test
        @DisplayName("trims extra questions down to the requested count")
        void trimsToRequestedCount() {
            // Given
            String raw = "{\"questions\": [" + VALID + "," + VALID.replace("2 + 2", "3 + 3") + "]}";

            // When
            QuestionSet set = parser.parseQuestionSet(raw, GenerationOptions.builder().numQuestions(1).build());

            // Then
            assertThat(set.getQuestions()).extracting(Question::stem).containsExactly("What is 2 + 2?");
        }
    }
}
