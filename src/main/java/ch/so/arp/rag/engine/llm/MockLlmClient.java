package ch.so.arp.rag.engine.llm;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Deterministic {@link LlmClient} used in tests and local development where no
 * completion service should be contacted.
 */
public class MockLlmClient implements LlmClient {

    @Override
    public String complete(String question, List<String> context, Map<String, Object> parameters) {
        StringJoiner answer = new StringJoiner("\n");
        answer.add("[mocked answer]");
        answer.add("Question was: " + question);
        if (!context.isEmpty()) {
            answer.add("Relevant context snippets: " + String.join(" | ", context));
        }
        answer.add("Total context snippets: " + context.size());
        return answer.toString();
    }

    @Override
    public String model() {
        return "mock";
    }
}
