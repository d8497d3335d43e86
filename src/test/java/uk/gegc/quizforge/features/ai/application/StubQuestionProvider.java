package uk.gegc.quizforge.features.ai.application;

import uk.gegc.quizforge.features.ai.domain.model.ConnectionTestResult;
import uk.gegc.quizforge.features.generation.domain.model.Difficulty;
import uk.gegc.quizforge.features.generation.domain.model.GenerationOptions;
import uk.gegc.quizforge.features.generation.domain.model.QuestionSet;
import uk.gegc.quizforge.testsupport.TestQuestions;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provider whose answers and failures are scripted by the test.
 */
class StubQuestionProvider implements QuestionProvider {

    private final String name;
    private final boolean configured;
    volatile RuntimeException failure;
    volatile String completion = "{}";
    final AtomicInteger calls = new AtomicInteger();

    StubQuestionProvider(String name, boolean configured) {
        this.name = name;
        this.configured = configured;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return name + " stub";
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public List<String> getSupportedModels() {
        return List.of(name + "-model");
    }

    @Override
    public String getCurrentModel() {
        return name + "-model";
    }

    @Override
    public int getCurrentModelIndex() {
        return 0;
    }

    @Override
    public QuestionSet generate(String text, GenerationOptions options) {
        calls.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
        int count = options.numQuestionsOrDefault();
        return TestQuestions.questionSet(TestQuestions.questions(0, count, Difficulty.MEDIUM), name);
    }

    @Override
    public String complete(String prompt) {
        calls.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
        return completion;
    }

    @Override
    public ConnectionTestResult testConnection() {
        if (failure != null) {
            throw failure;
        }
        return ConnectionTestResult.success(name, getCurrentModel(), name + " ok");
    }
}
