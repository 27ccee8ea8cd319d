package com.bko.ensemble.orchestration.runner;

import com.bko.ensemble.orchestration.model.InputItem;
import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.StreamResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Answers every call from a script. A {@code null} answer counts as a failed call.
 */
public class ScriptedInvoker implements InstanceInvoker {

    public static final MessageUsage USAGE = new MessageUsage(10, 5, 15, 0);

    private final Function<InvocationRequest, String> script;
    private final List<InvocationRequest> requests = new CopyOnWriteArrayList<>();

    public ScriptedInvoker(Function<InvocationRequest, String> script) {
        this.script = script;
    }

    @Override
    public StreamResult invoke(InvocationRequest request) {
        requests.add(request);
        String content = script.apply(request);
        return content == null ? null : new StreamResult(content, USAGE);
    }

    public List<InvocationRequest> requests() {
        return List.copyOf(requests);
    }

    public List<InvocationRequest> requestsTo(String modelId) {
        return requests.stream().filter(request -> request.modelId().equals(modelId)).toList();
    }

    public static String systemPrompt(InvocationRequest request) {
        return request.input().stream()
                .filter(item -> InputItem.SYSTEM.equals(item.role()))
                .map(InputItem::content)
                .findFirst()
                .orElse("");
    }

    public static String lastUserMessage(InvocationRequest request) {
        List<InputItem> input = request.input();
        for (int i = input.size() - 1; i >= 0; i--) {
            if (InputItem.USER.equals(input.get(i).role())) {
                return input.get(i).content();
            }
        }
        return "";
    }
}
