package uk.gegc.quizforge.features.generation.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.List;

/**
 * A validated multiple-choice question. Serialized in the flat wire format
 * ({@code questiontext}, {@code optiona}..{@code optiond}, {@code correctanswer}).
 */
@Builder(toBuilder = true)
@JsonPropertyOrder({"questiontext", "optiona", "optionb", "optionc", "optiond",
        "correctanswer", "difficulty", "cognitive_level", "rationale"})
public record Question(
        @JsonProperty("questiontext") String stem,
        @JsonProperty("optiona") String optionA,
        @JsonProperty("optionb") String optionB,
        @JsonProperty("optionc") String optionC,
        @JsonProperty("optiond") String optionD,
        @JsonProperty("correctanswer") AnswerLetter correct,
        @JsonProperty("difficulty") Difficulty difficulty,
        @JsonProperty("cognitive_level") CognitiveLevel cognitiveLevel,
        @JsonProperty("rationale") String rationale
) {

    @JsonIgnore
    public List<String> options() {
        return List.of(optionA, optionB, optionC, optionD);
    }

    @JsonIgnore
    public String correctOption() {
        return options().get(correct.index());
    }
}
