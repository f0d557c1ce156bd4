package io.agentmesh.dispatch;

import io.agentmesh.bus.MessageBus;
import io.agentmesh.error.AgentMeshException;
import io.agentmesh.error.AgentUnavailableException;
import io.agentmesh.model.Message;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.orchestrator.Orchestrator;
import io.agentmesh.orchestrator.WorkflowReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Entry point for a user query. Multi-step or low-confidence queries go to the
 * orchestrator, a query with a known target agent is delegated over the bus, and the rest
 * is answered directly.
 *
 * <p>An unavailable target gets one try on the fallback agent before the direct path.
 * Timeouts and agent errors come back as error results rather than exceptions.
 */
public final class Dispatcher {
    public static final String DISPATCHER_ID = "dispatcher";

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final MessageBus bus;
    private final Orchestrator orchestrator;
    private final QueryClassifier classifier;
    private final DirectResponder directResponder;
    private final String fallbackAgentId;
    private final double confidenceThreshold;

    public Dispatcher(
            MessageBus bus,
            Orchestrator orchestrator,
            QueryClassifier classifier,
            DirectResponder directResponder,
            String fallbackAgentId,
            double confidenceThreshold
    ) {
        this.bus = bus;
        this.orchestrator = orchestrator;
        this.classifier = classifier;
        this.directResponder = directResponder;
        this.fallbackAgentId = fallbackAgentId;
        this.confidenceThreshold = confidenceThreshold;
    }

    public DispatchResult process(String query, Map<String, Object> context) {
        Map<String, Object> ctx = context == null ? Map.of() : context;
        Classification classification = classifier.classify(query, ctx);
        log.debug("Classified query as {} target={} confidence={}",
                classification.category().wire(), classification.targetAgentId(), classification.confidence());

        if (classification.category() == Category.MULTI_STEP || classification.confidence() < confidenceThreshold) {
            return orchestrate(query, ctx);
        }
        if (classification.category() == Category.DELEGATE && classification.targetAgentId() != null) {
            return delegate(classification.targetAgentId(), query, ctx);
        }
        return direct(query, ctx);
    }

    private DispatchResult orchestrate(String query, Map<String, Object> ctx) {
        WorkflowReport report = orchestrator.run(query, ctx);
        boolean failed = report.status() == WorkflowStatus.FAILED;
        return new DispatchResult(DispatchResult.Route.ORCHESTRATED, null, report.summary(), report.workflowId(), failed);
    }

    private DispatchResult delegate(String targetAgentId, String query, Map<String, Object> ctx) {
        try {
            Message reply = bus.sendAndAwait(Message.request(DISPATCHER_ID, targetAgentId, query, ctx));
            return new DispatchResult(DispatchResult.Route.DELEGATED, targetAgentId, reply.content(), null, false);
        } catch (AgentUnavailableException e) {
            log.warn("Agent {} unavailable, trying fallback", targetAgentId);
        } catch (AgentMeshException e) {
            return failure(DispatchResult.Route.DELEGATED, targetAgentId, e);
        }

        if (fallbackAgentId != null && !fallbackAgentId.equals(targetAgentId)) {
            try {
                Message reply = bus.sendAndAwait(Message.request(DISPATCHER_ID, fallbackAgentId, query, ctx));
                return new DispatchResult(DispatchResult.Route.FALLBACK, fallbackAgentId, reply.content(), null, false);
            } catch (AgentUnavailableException e) {
                log.warn("Fallback agent {} unavailable, answering directly", fallbackAgentId);
            } catch (AgentMeshException e) {
                return failure(DispatchResult.Route.FALLBACK, fallbackAgentId, e);
            }
        }
        return direct(query, ctx);
    }

    private DispatchResult direct(String query, Map<String, Object> ctx) {
        return new DispatchResult(DispatchResult.Route.DIRECT, null, directResponder.respond(query, ctx), null, false);
    }

    private DispatchResult failure(DispatchResult.Route route, String agentId, AgentMeshException e) {
        String response = switch (e.kind()) {
            case TIMEOUT -> "Agent " + agentId + " did not answer in time";
            default -> "Agent " + agentId + " failed: " + e.getMessage();
        };
        return new DispatchResult(route, agentId, response, null, true);
    }
}
