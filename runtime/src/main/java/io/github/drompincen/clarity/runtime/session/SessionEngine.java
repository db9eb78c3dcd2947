package io.github.drompincen.clarity.runtime.session;

import io.github.drompincen.clarity.persistence.document.RabbitholeEventDocument;
import io.github.drompincen.clarity.persistence.document.RecallPointDocument;
import io.github.drompincen.clarity.persistence.document.RecallSetDocument;
import io.github.drompincen.clarity.persistence.document.SessionDocument;
import io.github.drompincen.clarity.persistence.document.SessionMessageDocument;
import io.github.drompincen.clarity.persistence.repository.RabbitholeEventRepository;
import io.github.drompincen.clarity.persistence.repository.RecallPointRepository;
import io.github.drompincen.clarity.persistence.repository.SessionMessageRepository;
import io.github.drompincen.clarity.persistence.repository.SessionRepository;
import io.github.drompincen.clarity.protocol.api.LearningState;
import io.github.drompincen.clarity.protocol.api.MessageRole;
import io.github.drompincen.clarity.protocol.api.RabbitholeStatus;
import io.github.drompincen.clarity.protocol.api.RecallRating;
import io.github.drompincen.clarity.protocol.api.SessionCompletionSummary;
import io.github.drompincen.clarity.protocol.api.SessionStatus;
import io.github.drompincen.clarity.runtime.analysis.RabbitholeDetector;
import io.github.drompincen.clarity.runtime.analysis.RabbitholeEvent;
import io.github.drompincen.clarity.runtime.fsrs.FsrsScheduler;
import io.github.drompincen.clarity.runtime.llm.CompletionOptions;
import io.github.drompincen.clarity.runtime.llm.LlmClient;
import io.github.drompincen.clarity.runtime.llm.LlmMessage;
import io.github.drompincen.clarity.runtime.prompt.RecallEvaluationPrompts;
import io.github.drompincen.clarity.runtime.prompt.RecallEvaluationPrompts.PointEvaluation;
import io.github.drompincen.clarity.runtime.prompt.TutorPrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Checklist-based recall session. Every learner message is evaluated against all points still
 * pending; recalled points are rescheduled with FSRS and the tutor keeps probing the rest. After
 * each main-line turn the tangent detector runs in the background and reports through the
 * {@link SessionEventListener}.
 *
 * <p>Public operations are serialized on the engine instance.
 */
public class SessionEngine implements SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionEngine.class);

    static final CompletionOptions EVALUATION_OPTIONS = CompletionOptions.of(0.3, 1024);
    static final int EVALUATION_WINDOW = 10;
    static final String CONTINUE_INSTRUCTION =
            "Continue the recall discussion and move on to a point the learner has not recalled yet.";

    private final SessionRepository sessionRepository;
    private final RecallPointRepository recallPointRepository;
    private final SessionMessageRepository messageRepository;
    private final RabbitholeEventRepository rabbitholeEventRepository;
    private final LlmClient llmClient;
    private final FsrsScheduler scheduler;
    private final RabbitholeDetector detector;
    private final SessionEngineConfig config;
    private final Clock clock;

    private volatile SessionEventListener listener;

    private SessionDocument session;
    private RecallSetDocument recallSet;
    private final Map<String, RecallPointDocument> points = new LinkedHashMap<>();
    private final Set<String> recalled = new LinkedHashSet<>();
    // pending points in probing order; a failed forced evaluation moves its point to the back
    private final List<String> probeOrder = new ArrayList<>();
    private final List<SessionMessageDocument> messages = new ArrayList<>();
    private boolean completionAnnounced;
    // credited by a turn whose reply failed; reported with the next reply that succeeds
    private final List<String> unreportedRecalls = new ArrayList<>();
    private boolean completionUnreported;
    private int declineCooldown;
    private String lastDetectedEventId;

    private RabbitholeAgent rabbitholeAgent;
    private String activeRabbitholeId;
    private int pointsRecalledInRabbithole;
    private boolean completionPending;

    public SessionEngine(SessionRepository sessionRepository,
                         RecallPointRepository recallPointRepository,
                         SessionMessageRepository messageRepository,
                         RabbitholeEventRepository rabbitholeEventRepository,
                         LlmClient llmClient,
                         FsrsScheduler scheduler,
                         RabbitholeDetector detector,
                         SessionEngineConfig config,
                         Clock clock) {
        this.sessionRepository = sessionRepository;
        this.recallPointRepository = recallPointRepository;
        this.messageRepository = messageRepository;
        this.rabbitholeEventRepository = rabbitholeEventRepository;
        this.llmClient = llmClient;
        this.scheduler = scheduler;
        this.detector = detector;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void setEventListener(SessionEventListener listener) {
        this.listener = listener;
    }

    // --- lifecycle ---

    @Override
    public synchronized SessionDocument startSession(RecallSetDocument recallSet) {
        List<SessionDocument> inProgress = sessionRepository.findByRecallSetIdAndStatus(
                recallSet.getRecallSetId(), SessionStatus.IN_PROGRESS);
        if (!inProgress.isEmpty()) {
            return resumeSession(inProgress.get(0), recallSet);
        }

        List<RecallPointDocument> all = recallPointRepository.findByRecallSetId(recallSet.getRecallSetId());
        if (all.isEmpty()) {
            throw new SessionEngineException("Recall set '" + recallSet.getName() + "' has no recall points");
        }
        Instant now = clock.instant();
        List<RecallPointDocument> due = all.stream()
                .filter(p -> p.getLearningState() == null || scheduler.isDue(p.getLearningState(), now))
                .toList();
        if (due.isEmpty()) {
            // nothing due yet: study the whole set rather than refuse
            due = all;
        }

        SessionDocument created = new SessionDocument();
        created.setSessionId("sess_" + UUID.randomUUID().toString().replace("-", ""));
        created.setRecallSetId(recallSet.getRecallSetId());
        created.setStatus(SessionStatus.IN_PROGRESS);
        created.setTargetRecallPointIds(new ArrayList<>(due.stream().map(RecallPointDocument::getRecallPointId).toList()));
        created.setRecalledPointIds(new ArrayList<>());
        created.setStartedAt(now);
        sessionRepository.save(created);

        load(created, recallSet, due, List.of());
        log.info("Started session {} for recall set {} with {} point(s)",
                created.getSessionId(), recallSet.getRecallSetId(), due.size());
        return created;
    }

    @Override
    public synchronized SessionDocument resumeSession(SessionDocument existing, RecallSetDocument recallSet) {
        if (existing.getStatus() != null && existing.getStatus().isTerminal()) {
            throw new SessionEngineException("Session " + existing.getSessionId() + " is " + existing.getStatus().value());
        }
        Map<String, RecallPointDocument> byId = new LinkedHashMap<>();
        for (RecallPointDocument point : recallPointRepository.findAllById(existing.getTargetRecallPointIds())) {
            byId.put(point.getRecallPointId(), point);
        }
        List<RecallPointDocument> targets = existing.getTargetRecallPointIds().stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .toList();
        if (targets.size() < existing.getTargetRecallPointIds().size()) {
            log.warn("Session {} references {} missing recall point(s)", existing.getSessionId(),
                    existing.getTargetRecallPointIds().size() - targets.size());
        }

        if (existing.getStatus() != SessionStatus.IN_PROGRESS) {
            existing.setStatus(SessionStatus.IN_PROGRESS);
            existing.setPausedAt(null);
            sessionRepository.save(existing);
        }

        load(existing, recallSet, targets, messageRepository.findBySessionIdOrderBySeqAsc(existing.getSessionId()));
        log.info("Resumed session {} ({}/{} recalled, {} message(s))",
                existing.getSessionId(), recalled.size(), points.size(), messages.size());
        return existing;
    }

    @Override
    public synchronized String getOpeningMessage() {
        requireSession();
        List<SessionMessageDocument> mainLine = mainLineMessages();
        if (!mainLine.isEmpty() && mainLine.get(mainLine.size() - 1).getRole() == MessageRole.ASSISTANT) {
            // resumed right after a tutor turn: repeat it instead of asking twice
            return mainLine.get(mainLine.size() - 1).getContent();
        }
        String opening = tutorReply(TutorPrompts.OPENING_INSTRUCTION);
        saveMessage(MessageRole.ASSISTANT, opening, null);
        return opening;
    }

    @Override
    public synchronized Optional<SessionState> getSessionState() {
        if (session == null) {
            return Optional.empty();
        }
        RecallPointDocument probe = currentProbePoint();
        return Optional.of(new SessionState(
                session.getSessionId(),
                session.getRecallSetId(),
                session.getStatus(),
                points.size(),
                recalled.size(),
                List.copyOf(recalled),
                probe != null ? probe.getRecallPointId() : null,
                messages.size(),
                rabbitholeAgent != null,
                rabbitholeAgent != null ? rabbitholeAgent.getTopic() : null,
                session.getStartedAt()));
    }

    // --- turns ---

    @Override
    public ProcessMessageResult processUserMessage(String content) {
        if (content == null || content.isBlank()) {
            throw new SessionEngineException("Message content must not be empty");
        }
        AnalysisRequest analysis;
        ProcessMessageResult result;
        synchronized (this) {
            requireSession();
            if (rabbitholeAgent != null) {
                return processRabbitholeMessage(content);
            }

            saveLearnerMessage(content, null);
            int messageIndex = messages.size() - 1;

            unreportedRecalls.addAll(evaluate(pendingPoints()));
            if (announceCompletionIfReached()) {
                completionUnreported = true;
            }

            String response = tutorReply(CONTINUE_INSTRUCTION);
            saveMessage(MessageRole.ASSISTANT, response, null);

            boolean detectNew = declineCooldown == 0;
            if (declineCooldown > 0) {
                declineCooldown--;
            }
            analysis = new AnalysisRequest(session.getSessionId(), List.copyOf(messages), currentProbePoint(),
                    List.copyOf(points.values()), messageIndex, detectNew);
            result = reportTurn(response);
        }
        runAnalysis(analysis);
        return result;
    }

    @Override
    public synchronized ProcessMessageResult triggerEvaluation() {
        requireSession();
        if (rabbitholeAgent != null) {
            throw new SessionEngineException("Cannot evaluate while exploring a tangent");
        }
        RecallPointDocument probe = currentProbePoint();
        if (probe != null) {
            List<String> recalledNow = evaluate(List.of(probe));
            unreportedRecalls.addAll(recalledNow);
            if (recalledNow.isEmpty()) {
                recordFailedAttempt(probe);
                probeOrder.remove(probe.getRecallPointId());
                probeOrder.add(probe.getRecallPointId());
            }
        }
        if (announceCompletionIfReached()) {
            completionUnreported = true;
        }
        String response = tutorReply(CONTINUE_INSTRUCTION);
        saveMessage(MessageRole.ASSISTANT, response, null);
        return reportTurn(response);
    }

    private ProcessMessageResult processRabbitholeMessage(String content) {
        saveLearnerMessage(content, activeRabbitholeId);
        List<String> recalledNow = evaluate(pendingPoints());
        unreportedRecalls.addAll(recalledNow);
        pointsRecalledInRabbithole += recalledNow.size();
        if (announceCompletionIfReached()) {
            completionPending = true;
        }
        String response = rabbitholeAgent.generateResponse(content);
        saveMessage(MessageRole.ASSISTANT, response, activeRabbitholeId);
        List<String> reported = List.copyOf(unreportedRecalls);
        unreportedRecalls.clear();
        return new ProcessMessageResult(response, reported, recalled.size(), points.size(), false);
    }

    /** Hands out everything credited since the last successful reply, then forgets it. */
    private ProcessMessageResult reportTurn(String response) {
        ProcessMessageResult result = new ProcessMessageResult(response, List.copyOf(unreportedRecalls),
                recalled.size(), points.size(), completionUnreported);
        unreportedRecalls.clear();
        completionUnreported = false;
        return result;
    }

    // --- rabbitholes ---

    @Override
    public synchronized String enterRabbithole(String rabbitholeEventId, String topic) {
        requireSession();
        if (rabbitholeAgent != null) {
            throw new SessionEngineException("Already exploring \"" + rabbitholeAgent.getTopic() + "\"");
        }
        RabbitholeAgent agent = new RabbitholeAgent(llmClient, topic, recallSet);
        String opening = agent.generateOpeningMessage();

        rabbitholeAgent = agent;
        activeRabbitholeId = rabbitholeEventId;
        pointsRecalledInRabbithole = 0;
        completionPending = false;
        if (rabbitholeEventId.equals(lastDetectedEventId)) {
            lastDetectedEventId = null;
        }
        rabbitholeEventRepository.findById(rabbitholeEventId).ifPresent(doc -> {
            doc.setEntered(true);
            rabbitholeEventRepository.save(doc);
        });
        saveMessage(MessageRole.ASSISTANT, opening, rabbitholeEventId);
        log.info("Session {} entered tangent {} \"{}\"", session.getSessionId(), rabbitholeEventId, topic);
        return opening;
    }

    @Override
    public synchronized RabbitholeExit exitRabbithole() {
        requireSession();
        if (rabbitholeAgent == null) {
            throw new SessionEngineException("Not exploring a tangent");
        }
        RabbitholeExit exit = new RabbitholeExit(rabbitholeAgent.getTopic(), pointsRecalledInRabbithole, completionPending);
        detector.remove(activeRabbitholeId);
        closeEventDocument(activeRabbitholeId, RabbitholeStatus.RETURNED, Math.max(messages.size() - 1, 0));
        log.info("Session {} left tangent {} ({} point(s) recalled inside)",
                session.getSessionId(), activeRabbitholeId, pointsRecalledInRabbithole);
        clearRabbithole();
        return exit;
    }

    @Override
    public synchronized void declineRabbithole() {
        requireSession();
        declineCooldown = config.declineCooldownMessages();
        if (lastDetectedEventId != null) {
            detector.remove(lastDetectedEventId);
            closeEventDocument(lastDetectedEventId, RabbitholeStatus.ABANDONED, Math.max(messages.size() - 1, 0));
            log.debug("Session {} declined tangent {}", session.getSessionId(), lastDetectedEventId);
            lastDetectedEventId = null;
        }
    }

    // --- endings ---

    @Override
    public synchronized void pauseSession() {
        requireSession();
        closeOpenRabbitholes();
        session.setStatus(SessionStatus.PAUSED);
        session.setPausedAt(clock.instant());
        session.setRecalledPointIds(new ArrayList<>(recalled));
        sessionRepository.save(session);
        log.info("Paused session {} at {}/{} recalled", session.getSessionId(), recalled.size(), points.size());
        clearSession();
    }

    @Override
    public synchronized void abandonSession() {
        requireSession();
        closeOpenRabbitholes();
        session.setStatus(SessionStatus.ABANDONED);
        session.setEndedAt(clock.instant());
        session.setRecalledPointIds(new ArrayList<>());
        sessionRepository.save(session);
        log.info("Abandoned session {}", session.getSessionId());
        clearSession();
    }

    @Override
    public synchronized SessionCompletionSummary completeSession() {
        requireSession();
        closeOpenRabbitholes();
        Instant endedAt = clock.instant();
        session.setStatus(SessionStatus.COMPLETED);
        session.setEndedAt(endedAt);
        session.setRecalledPointIds(new ArrayList<>(recalled));
        sessionRepository.save(session);

        int total = points.size();
        long durationMs = session.getStartedAt() != null
                ? Duration.between(session.getStartedAt(), endedAt).toMillis() : 0;
        SessionCompletionSummary summary = new SessionCompletionSummary(
                session.getSessionId(),
                total,
                recalled.size(),
                total == 0 ? 0 : (double) recalled.size() / total,
                durationMs,
                (int) rabbitholeEventRepository.countBySessionId(session.getSessionId()),
                List.copyOf(recalled));
        log.info("Completed session {}: {}/{} recalled in {} ms", session.getSessionId(), recalled.size(), total, durationMs);
        clearSession();
        return summary;
    }

    @Override
    public synchronized void close() {
        detector.reset();
        listener = null;
        clearSession();
    }

    // --- evaluation ---

    private List<String> evaluate(List<RecallPointDocument> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        Set<String> candidateIds = new LinkedHashSet<>();
        candidates.forEach(p -> candidateIds.add(p.getRecallPointId()));
        String prompt = RecallEvaluationPrompts.buildChecklistPrompt(candidates, tail(messages, EVALUATION_WINDOW));
        List<PointEvaluation> evaluations =
                RecallEvaluationPrompts.parseChecklist(llmClient.complete(prompt, EVALUATION_OPTIONS).text(), candidateIds);

        Instant now = clock.instant();
        long latencyMs = latencySinceLastTutorTurn(now);
        List<String> recalledNow = new ArrayList<>();
        for (PointEvaluation evaluation : evaluations) {
            RecallRating rating = evaluation.rating();
            if (!evaluation.success() || rating == RecallRating.FORGOT || recalled.contains(evaluation.pointId())) {
                continue;
            }
            RecallPointDocument point = points.get(evaluation.pointId());
            applyReview(point, rating, true, now, latencyMs);
            recalled.add(point.getRecallPointId());
            probeOrder.remove(point.getRecallPointId());
            recalledNow.add(point.getRecallPointId());
            log.debug("Session {} recalled point {} ({}, confidence {})",
                    session.getSessionId(), point.getRecallPointId(), rating, evaluation.confidence());
        }
        if (!recalledNow.isEmpty()) {
            session.setRecalledPointIds(new ArrayList<>(recalled));
            sessionRepository.save(session);
        }
        return recalledNow;
    }

    private void recordFailedAttempt(RecallPointDocument point) {
        Instant now = clock.instant();
        applyReview(point, RecallRating.FORGOT, false, now, latencySinceLastTutorTurn(now));
    }

    private void applyReview(RecallPointDocument point, RecallRating rating, boolean success, Instant now, long latencyMs) {
        LearningState current = point.getLearningState() != null
                ? point.getLearningState()
                : scheduler.createInitialState(point.getCreatedAt() != null ? point.getCreatedAt() : now);
        point.setLearningState(scheduler.schedule(current, rating, now));
        point.getRecallHistory().add(new RecallPointDocument.RecallAttempt(now, success, latencyMs));
        point.setUpdatedAt(now);
        recallPointRepository.save(point);
    }

    private boolean announceCompletionIfReached() {
        if (completionAnnounced || points.isEmpty() || recalled.size() < points.size()) {
            return false;
        }
        completionAnnounced = true;
        return true;
    }

    private long latencySinceLastTutorTurn(Instant now) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            SessionMessageDocument message = messages.get(i);
            if (message.getRole() == MessageRole.ASSISTANT && message.getTimestamp() != null) {
                return Math.max(0, Duration.between(message.getTimestamp(), now).toMillis());
            }
        }
        return 0;
    }

    // --- tutor ---

    private String tutorReply(String instructionIfTutorSpokeLast) {
        String systemPrompt = TutorPrompts.buildTutorSystemPrompt(
                recallSet, pendingPoints(), recalledPoints(), currentProbePoint());
        List<LlmMessage> history = toHistory(mainLineMessages());
        if (history.isEmpty() || history.get(history.size() - 1).role() != MessageRole.USER) {
            history.add(LlmMessage.user(instructionIfTutorSpokeLast));
        }
        return llmClient.chat(systemPrompt, history,
                CompletionOptions.of(config.tutorTemperature(), config.tutorMaxTokens())).text();
    }

    /** Alternating learner/tutor turns starting with a learner turn; consecutive turns by one side are merged. */
    static List<LlmMessage> toHistory(List<SessionMessageDocument> source) {
        List<LlmMessage> history = new ArrayList<>();
        for (SessionMessageDocument message : source) {
            if (message.getRole() == MessageRole.SYSTEM) continue;
            if (history.isEmpty() && message.getRole() == MessageRole.ASSISTANT) {
                history.add(LlmMessage.user(TutorPrompts.OPENING_INSTRUCTION));
            }
            int last = history.size() - 1;
            if (last >= 0 && history.get(last).role() == message.getRole()) {
                history.set(last, new LlmMessage(message.getRole(), history.get(last).content() + "\n\n" + message.getContent()));
            } else {
                history.add(new LlmMessage(message.getRole(), message.getContent()));
            }
        }
        return history;
    }

    // --- background analysis ---

    private record AnalysisRequest(String sessionId, List<SessionMessageDocument> messages,
                                   RecallPointDocument currentPoint, List<RecallPointDocument> allPoints,
                                   int messageIndex, boolean detectNew) {}

    private void runAnalysis(AnalysisRequest request) {
        if (request.currentPoint() == null) {
            return;
        }
        detector.detectReturns(request.messages(), request.currentPoint(), request.messageIndex())
                .whenComplete((returned, error) -> {
                    if (error != null) {
                        logAnalysisFailure(request.sessionId(), "return detection", error);
                    } else {
                        returned.forEach(event -> onReturned(request.sessionId(), event));
                    }
                });
        if (!request.detectNew()) {
            return;
        }
        detector.detectRabbithole(request.sessionId(), request.messages(), request.currentPoint(),
                        request.allPoints(), request.messageIndex())
                .whenComplete((event, error) -> {
                    if (error != null) {
                        logAnalysisFailure(request.sessionId(), "tangent detection", error);
                    } else if (event != null) {
                        onDetected(request.sessionId(), event);
                    }
                });
    }

    private void onDetected(String sessionId, RabbitholeEvent event) {
        synchronized (this) {
            if (session == null || !session.getSessionId().equals(sessionId)) {
                log.debug("Dropping tangent {} detected after session {} ended", event.id(), sessionId);
                return;
            }
            rabbitholeEventRepository.save(toDocument(sessionId, event));
            lastDetectedEventId = event.id();
        }
        SessionEventListener current = listener;
        if (current != null) {
            current.onRabbitholeDetected(sessionId, event);
        }
    }

    private void onReturned(String sessionId, RabbitholeEvent event) {
        closeEventDocument(sessionId, event, RabbitholeStatus.RETURNED);
        synchronized (this) {
            if (event.id().equals(lastDetectedEventId)) {
                lastDetectedEventId = null;
            }
        }
        SessionEventListener current = listener;
        if (current != null) {
            current.onRabbitholeReturned(sessionId, event);
        }
    }

    private static void logAnalysisFailure(String sessionId, String stage, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof CancellationException) {
            log.debug("Session {} {} cancelled", sessionId, stage);
        } else {
            log.warn("Session {} {} failed: {}", sessionId, stage, cause.getMessage(), cause);
        }
    }

    private void closeOpenRabbitholes() {
        int finalIndex = Math.max(messages.size() - 1, 0);
        for (RabbitholeEvent event : detector.closeAllActive(finalIndex)) {
            closeEventDocument(session.getSessionId(), event, RabbitholeStatus.ABANDONED);
        }
        if (activeRabbitholeId != null) {
            // entered but already gone from the detector, e.g. returned in the background
            rabbitholeEventRepository.findById(activeRabbitholeId)
                    .filter(doc -> doc.getStatus() == RabbitholeStatus.ACTIVE)
                    .ifPresent(doc -> {
                        doc.setStatus(RabbitholeStatus.ABANDONED);
                        doc.setReturnMessageIndex(finalIndex);
                        doc.setClosedAt(clock.instant());
                        rabbitholeEventRepository.save(doc);
                    });
        }
        // drop anything still queued so late results cannot reopen a tangent
        detector.reset();
        clearRabbithole();
    }

    private void closeEventDocument(String sessionId, RabbitholeEvent event, RabbitholeStatus status) {
        RabbitholeEventDocument doc = rabbitholeEventRepository.findById(event.id())
                .orElseGet(() -> toDocument(sessionId, event));
        doc.setStatus(status);
        doc.setReturnMessageIndex(event.returnMessageIndex());
        doc.setClosedAt(clock.instant());
        rabbitholeEventRepository.save(doc);
    }

    private void closeEventDocument(String eventId, RabbitholeStatus status, int messageIndex) {
        rabbitholeEventRepository.findById(eventId).ifPresent(doc -> {
            doc.setStatus(status);
            doc.setReturnMessageIndex(messageIndex);
            doc.setClosedAt(clock.instant());
            rabbitholeEventRepository.save(doc);
        });
    }

    private static RabbitholeEventDocument toDocument(String sessionId, RabbitholeEvent event) {
        RabbitholeEventDocument doc = new RabbitholeEventDocument();
        doc.setEventId(event.id());
        doc.setSessionId(sessionId);
        doc.setTopic(event.topic());
        doc.setTriggerMessageIndex(event.triggerMessageIndex());
        doc.setReturnMessageIndex(event.returnMessageIndex());
        doc.setDepth(event.depth());
        doc.setRelatedRecallPointIds(new ArrayList<>(event.relatedRecallPointIds()));
        doc.setUserInitiated(event.userInitiated());
        doc.setStatus(event.status());
        doc.setDetectedAt(event.detectedAt());
        return doc;
    }

    // --- state helpers ---

    private void load(SessionDocument loaded, RecallSetDocument set, List<RecallPointDocument> targets,
                      List<SessionMessageDocument> history) {
        detector.reset();
        clearSession();
        session = loaded;
        recallSet = set;
        targets.forEach(p -> points.put(p.getRecallPointId(), p));
        for (String id : loaded.getRecalledPointIds()) {
            if (points.containsKey(id)) {
                recalled.add(id);
            }
        }
        points.keySet().stream().filter(id -> !recalled.contains(id)).forEach(probeOrder::add);
        messages.addAll(history);
        completionAnnounced = !points.isEmpty() && recalled.size() == points.size();
    }

    private void clearSession() {
        clearRabbithole();
        session = null;
        recallSet = null;
        points.clear();
        recalled.clear();
        probeOrder.clear();
        messages.clear();
        completionAnnounced = false;
        unreportedRecalls.clear();
        completionUnreported = false;
        declineCooldown = 0;
        lastDetectedEventId = null;
    }

    private void clearRabbithole() {
        rabbitholeAgent = null;
        activeRabbitholeId = null;
        pointsRecalledInRabbithole = 0;
        completionPending = false;
    }

    private void requireSession() {
        if (session == null) {
            throw new SessionEngineException("No active session");
        }
    }

    /** A resend of a learner message whose reply failed reuses the stored message. */
    private void saveLearnerMessage(String content, String rabbitholeEventId) {
        if (!messages.isEmpty()) {
            SessionMessageDocument last = messages.get(messages.size() - 1);
            if (last.getRole() == MessageRole.USER && last.getContent().equals(content)
                    && Objects.equals(last.getRabbitholeEventId(), rabbitholeEventId)) {
                log.debug("Session {} retrying unanswered message {}", session.getSessionId(), last.getMessageId());
                return;
            }
        }
        saveMessage(MessageRole.USER, content, rabbitholeEventId);
    }

    private SessionMessageDocument saveMessage(MessageRole role, String content, String rabbitholeEventId) {
        SessionMessageDocument message = new SessionMessageDocument();
        message.setMessageId("msg_" + UUID.randomUUID());
        message.setSessionId(session.getSessionId());
        message.setSeq(messages.isEmpty() ? 0 : messages.get(messages.size() - 1).getSeq() + 1);
        message.setRole(role);
        message.setContent(content);
        message.setTimestamp(clock.instant());
        message.setRabbitholeEventId(rabbitholeEventId);
        messageRepository.save(message);
        messages.add(message);
        return message;
    }

    private RecallPointDocument currentProbePoint() {
        return probeOrder.isEmpty() ? null : points.get(probeOrder.get(0));
    }

    private List<RecallPointDocument> pendingPoints() {
        return probeOrder.stream().map(points::get).toList();
    }

    private List<RecallPointDocument> recalledPoints() {
        return recalled.stream().map(points::get).toList();
    }

    private List<SessionMessageDocument> mainLineMessages() {
        return messages.stream().filter(m -> m.getRabbitholeEventId() == null).toList();
    }

    private static <T> List<T> tail(List<T> list, int size) {
        return list.size() <= size ? List.copyOf(list) : List.copyOf(list.subList(list.size() - size, list.size()));
    }
}
