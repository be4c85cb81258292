package com.ai.coach.service;

import com.ai.coach.component.ContentResolver;
import com.ai.coach.component.EventTriggerCallback;
import com.ai.coach.config.ChatEngineSettings;
import com.ai.coach.store.KeyValueStore;
import com.ai.coach.utils.ActiveDateCalculator;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Wires a {@link ChatEngine} for one session. Shared, stateless collaborators (loader,
 * formatters, content, event sink) come from the context; everything that holds session
 * state is created here.
 */
@Component
public class ChatEngineFactory {

    private final SequenceLoader sequenceLoader;
    private final FormatterService formatterService;
    private final ContentResolver contentResolver;
    private final EventTriggerCallback eventCallback;
    private final ChatEngineSettings settings;
    private final Clock clock;

    public ChatEngineFactory(SequenceLoader sequenceLoader,
                             FormatterService formatterService,
                             ContentResolver contentResolver,
                             EventTriggerCallback eventCallback,
                             ChatEngineSettings settings,
                             Clock clock) {
        this.sequenceLoader = sequenceLoader;
        this.formatterService = formatterService;
        this.contentResolver = contentResolver;
        this.eventCallback = eventCallback;
        this.settings = settings;
        this.clock = clock;
    }

    public ChatEngine create(String sessionId, KeyValueStore store) {
        SequenceTransitionManager transitionManager = new SequenceTransitionManager(sessionId, sequenceLoader,
                settings.getInitialMessageId());
        TextTemplatingService templating = new TextTemplatingService(store, formatterService);
        ConditionEvaluator conditions = new ConditionEvaluator(store);
        TemplateFunctionResolver functions = new TemplateFunctionResolver(new ActiveDateCalculator(store, clock, settings));

        FlowOrchestrator orchestrator = new FlowOrchestrator(
                sessionId,
                new FlowTraverser(sessionId, transitionManager, settings.getMaxTraversalDepth()),
                new RouteProcessor(sessionId, conditions, transitionManager),
                new DataActionProcessor(store, functions, templating, eventCallback),
                transitionManager,
                new MessageRenderer(templating, contentResolver, settings.getMultiTextSeparator()),
                settings.getMaxProcessingCycles());

        return new ChatEngine(sessionId, store, transitionManager, orchestrator);
    }

    public ChatEngineSettings getSettings() {
        return settings;
    }
}
