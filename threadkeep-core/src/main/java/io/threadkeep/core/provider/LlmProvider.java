package io.threadkeep.core.provider;

import io.threadkeep.core.model.Message;
import java.util.List;

public interface LlmProvider {
    String ERROR_PREFIX = "Error calling LLM:";

    String name();

    LlmResponse chat(String model, List<Message> messages);
}
