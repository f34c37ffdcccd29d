package ch.so.arp.rag.engine.llm;

import java.util.List;
import java.util.Map;

/**
 * Abstraction over the completion model. Implementations can either invoke an
 * OpenAI compatible API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Answers a question from the given context.
     *
     * @param question   the user question
     * @param context    retrieved chunk texts, most relevant first
     * @param parameters model parameters such as {@code temperature} or
     *                   {@code max_tokens}, passed through to the model
     * @return the generated answer
     */
    String complete(String question, List<String> context, Map<String, Object> parameters);

    /**
     * Name of the model answering, reported with query results.
     */
    String model();
}
