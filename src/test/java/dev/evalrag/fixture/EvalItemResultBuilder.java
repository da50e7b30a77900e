package dev.evalrag.fixture;

import dev.evalrag.eval.EvalDatasetItem;
import dev.evalrag.eval.EvalItemResult;
import dev.evalrag.generation.TokenUsage;
import dev.evalrag.judge.JudgeVerdict;
import dev.evalrag.rag.AnswerResult;
import dev.evalrag.retrieval.RetrievedContext;
import java.util.List;

/**
 * Test builder for {@link EvalItemResult}.
 * Defaults to a successful item with perfect scores, 100 ms latency and 10/5 tokens.
 *
 * <pre>{@code
 * EvalItemResult result = new EvalItemResultBuilder().id("q1").scores(0.8, 1.0, 0.5).build();
 * EvalItemResult failed = new EvalItemResultBuilder().id("q2").failed("GenerationError: boom");
 * }</pre>
 */
public final class EvalItemResultBuilder {

    private String id = "q1";
    private String question = "What is the capital of France?";
    private String expectedAnswer = "Paris";
    private String answerText = "Paris.";
    private long latencyMs = 100;
    private TokenUsage tokenUsage = new TokenUsage(10, 5);
    private double correctness = 1.0;
    private double faithfulness = 1.0;
    private double contextRelevance = 1.0;

    public EvalItemResultBuilder id(String id) {
        this.id = id;
        return this;
    }

    public EvalItemResultBuilder question(String question) {
        this.question = question;
        return this;
    }

    public EvalItemResultBuilder answerText(String answerText) {
        this.answerText = answerText;
        return this;
    }

    public EvalItemResultBuilder latencyMs(long latencyMs) {
        this.latencyMs = latencyMs;
        return this;
    }

    public EvalItemResultBuilder tokens(long promptTokens, long completionTokens) {
        this.tokenUsage = new TokenUsage(promptTokens, completionTokens);
        return this;
    }

    public EvalItemResultBuilder scores(double correctness, double faithfulness, double contextRelevance) {
        this.correctness = correctness;
        this.faithfulness = faithfulness;
        this.contextRelevance = contextRelevance;
        return this;
    }

    public EvalDatasetItem item() {
        return new EvalDatasetItem(id, question, expectedAnswer, List.of());
    }

    public AnswerResult answer() {
        return new AnswerResult(
                question,
                answerText,
                List.of(new RetrievedContext(id + "-doc#0", "Paris is the capital of France.", 0.9)),
                latencyMs,
                tokenUsage,
                "gpt-test");
    }

    public EvalItemResult build() {
        return EvalItemResult.success(
                item(), answer(), JudgeVerdict.scored(correctness, faithfulness, contextRelevance, "ok"));
    }

    public EvalItemResult partial(String error) {
        return EvalItemResult.partial(item(), answer(), error);
    }

    public EvalItemResult rejected(String error) {
        return EvalItemResult.rejectedVerdict(item(), answer(), error);
    }

    public EvalItemResult failed(String error) {
        return EvalItemResult.failed(item(), error);
    }
}
