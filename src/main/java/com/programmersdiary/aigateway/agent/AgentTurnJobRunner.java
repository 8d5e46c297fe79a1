package com.programmersdiary.aigateway.agent;

import com.programmersdiary.aigateway.cron.CronJob;
import com.programmersdiary.aigateway.cron.CronJobRunner;
import com.programmersdiary.aigateway.cron.CronRunResult;
import com.programmersdiary.aigateway.cron.SessionTarget;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs an {@code agentTurn} payload as a single model call. Isolated jobs start from an empty
 * conversation; shared jobs continue one rolling conversation common to all shared jobs.
 */
@Component
public class AgentTurnJobRunner implements CronJobRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentTurnJobRunner.class);

    private final AgentProperties properties;
    private final ChatModelFactory chatModelFactory;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final LinkedList<Message> sharedSession = new LinkedList<>();

    public AgentTurnJobRunner(AgentProperties properties, ChatModelFactory chatModelFactory) {
        this.properties = properties;
        this.chatModelFactory = chatModelFactory;
    }

    @Override
    public CompletableFuture<CronRunResult> run(CronJob job) {
        var payload = job.payload();
        var provider = properties.resolve(payload.provider())
                .orElseThrow(() -> new IllegalArgumentException(
                        "No model provider configured for cron job " + job.id()
                                + (payload.provider() != null ? " (wanted '" + payload.provider() + "')" : "")));
        return CompletableFuture.supplyAsync(() -> turn(job, provider), executor);
    }

    private CronRunResult turn(CronJob job, ProviderConfig provider) {
        var payload = job.payload();
        var shared = job.sessionTarget() == SessionTarget.SHARED;
        var messages = new ArrayList<Message>();
        if (!properties.systemInstructions().isBlank()) {
            messages.add(new SystemMessage(properties.systemInstructions()));
        }
        if (shared) {
            synchronized (sharedSession) {
                messages.addAll(sharedSession);
            }
        }
        var userMessage = new UserMessage(payload.message());
        messages.add(userMessage);

        log.debug("Agent turn for cron job '{}' on provider {}", job.displayName(), provider.id());
        var chatModel = chatModelFactory.create(provider, payload.model());
        var response = chatModel.call(new Prompt(messages));
        var result = response != null ? response.getResult() : null;
        var output = result != null ? result.getOutput() : null;
        var text = output != null ? output.getText() : null;
        if (text == null || text.isBlank()) {
            return CronRunResult.error("Model returned an empty reply");
        }
        if (shared) {
            remember(List.of(userMessage, new AssistantMessage(text)));
        }
        return CronRunResult.ok(text.trim());
    }

    private void remember(List<Message> turn) {
        synchronized (sharedSession) {
            sharedSession.addAll(turn);
            while (sharedSession.size() > properties.sharedSessionMaxMessages()) {
                sharedSession.removeFirst();
            }
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
    }
}
