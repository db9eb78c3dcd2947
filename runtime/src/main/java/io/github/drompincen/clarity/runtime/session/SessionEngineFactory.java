package io.github.drompincen.clarity.runtime.session;

import io.github.drompincen.clarity.persistence.repository.RabbitholeEventRepository;
import io.github.drompincen.clarity.persistence.repository.RecallPointRepository;
import io.github.drompincen.clarity.persistence.repository.SessionMessageRepository;
import io.github.drompincen.clarity.persistence.repository.SessionRepository;
import io.github.drompincen.clarity.runtime.analysis.RabbitholeDetector;
import io.github.drompincen.clarity.runtime.analysis.RabbitholeDetectorConfig;
import io.github.drompincen.clarity.runtime.fsrs.FsrsScheduler;
import io.github.drompincen.clarity.runtime.llm.LlmClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Builds one engine per connection. Each engine gets its own detector, so tangent state is never
 * shared between sessions; the analysis executor is shared.
 */
@Component
public class SessionEngineFactory {

    private final SessionRepository sessionRepository;
    private final RecallPointRepository recallPointRepository;
    private final SessionMessageRepository messageRepository;
    private final RabbitholeEventRepository rabbitholeEventRepository;
    private final LlmClient llmClient;
    private final FsrsScheduler scheduler;
    private final RabbitholeDetectorConfig detectorConfig;
    private final SessionEngineConfig engineConfig;
    private final Executor analysisExecutor;

    public SessionEngineFactory(SessionRepository sessionRepository,
                                RecallPointRepository recallPointRepository,
                                SessionMessageRepository messageRepository,
                                RabbitholeEventRepository rabbitholeEventRepository,
                                LlmClient llmClient,
                                FsrsScheduler scheduler,
                                RabbitholeDetectorConfig detectorConfig,
                                SessionEngineConfig engineConfig,
                                @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.sessionRepository = sessionRepository;
        this.recallPointRepository = recallPointRepository;
        this.messageRepository = messageRepository;
        this.rabbitholeEventRepository = rabbitholeEventRepository;
        this.llmClient = llmClient;
        this.scheduler = scheduler;
        this.detectorConfig = detectorConfig;
        this.engineConfig = engineConfig;
        this.analysisExecutor = analysisExecutor;
    }

    public SessionOrchestrator create() {
        RabbitholeDetector detector = new RabbitholeDetector(llmClient, detectorConfig, analysisExecutor);
        return new SessionEngine(sessionRepository, recallPointRepository, messageRepository,
                rabbitholeEventRepository, llmClient, scheduler, detector, engineConfig, Clock.systemUTC());
    }
}
