package io.agentmesh.runtime;

import io.agentmesh.agent.Agent;
import io.agentmesh.agent.EchoAgent;
import io.agentmesh.agent.FailAgent;
import io.agentmesh.agent.ScriptAgent;
import io.agentmesh.bus.MessageBus;
import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.dispatch.DefaultDirectResponder;
import io.agentmesh.dispatch.DispatchResult;
import io.agentmesh.dispatch.Dispatcher;
import io.agentmesh.dispatch.KeywordClassifier;
import io.agentmesh.model.AgentRecord;
import io.agentmesh.model.Capability;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowSummary;
import io.agentmesh.model.WorkflowView;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.orchestrator.Orchestrator;
import io.agentmesh.orchestrator.RuleBasedPlanner;
import io.agentmesh.storage.Database;
import io.agentmesh.storage.InMemoryWorkflowStore;
import io.agentmesh.storage.JdbcWorkflowStore;
import io.agentmesh.storage.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Wires bus, orchestrator, dispatcher, history store and audit trail from an
 * {@link AgentMeshConfig}. The echo and fail agents are always registered, plus every
 * script agent declared in settings.
 */
public final class AgentMeshRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentMeshRuntime.class);
    private static final String ACTOR = "agentmesh";

    private final AgentMeshConfig config;
    private final MeshSettings settings;
    private final MessageBus bus;
    private final WorkflowStore store;
    private final Orchestrator orchestrator;
    private final Dispatcher dispatcher;
    private final AuditLogger auditLogger;

    public AgentMeshRuntime(AgentMeshConfig config) {
        this(config, MeshSettings.load(config.settingsFile()));
    }

    public AgentMeshRuntime(AgentMeshConfig config, MeshSettings loaded) {
        this.config = config;
        this.settings = loaded.fallbackAgentId() == null ? loaded.withFallbackAgentId(EchoAgent.DEFAULT_ID) : loaded;
        this.auditLogger = new AuditLogger(config.auditFile());
        this.store = createStore(config, settings);
        this.bus = new MessageBus(settings);
        this.orchestrator = new Orchestrator(bus, new RuleBasedPlanner(), store, settings);
        this.dispatcher = new Dispatcher(
                bus,
                orchestrator,
                new KeywordClassifier(settings.routes()),
                new DefaultDirectResponder("AgentMesh", bus::listAgentIds),
                settings.fallbackAgentId(),
                settings.confidenceThreshold()
        );
        registerBuiltIns();
    }

    public AgentMeshConfig config() {
        return config;
    }

    public MeshSettings settings() {
        return settings;
    }

    public MessageBus bus() {
        return bus;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public void register(Agent agent) {
        bus.register(agent);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "agent.registered",
                ACTOR,
                agent.id(),
                "ok",
                Map.of("kind", agent.kind().wire(), "capabilities", capabilityTags(agent.capabilities()))
        ));
    }

    public DispatchResult ask(String query, Map<String, Object> context) {
        DispatchResult result = dispatcher.process(query, context);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("route", result.route().wire());
        if (result.agentId() != null) {
            details.put("agent", result.agentId());
        }
        if (result.workflowId() != null) {
            details.put("workflow_id", result.workflowId());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "query.dispatched",
                ACTOR,
                result.workflowId() == null ? "query" : result.workflowId(),
                result.error() ? "error" : "ok",
                details
        ));
        if (result.workflowId() != null) {
            store.find(result.workflowId()).ifPresent(view -> auditLogger.log(AuditLogger.AuditEvent.of(
                    "workflow.finished",
                    ACTOR,
                    view.id(),
                    view.status().wire(),
                    Map.of("subtasks", view.subtasks().size())
            )));
        }
        return result;
    }

    public List<WorkflowSummary> workflows(WorkflowStatus statusFilter) {
        return orchestrator.listWorkflows(statusFilter);
    }

    public Optional<WorkflowView> workflow(String workflowId) {
        return orchestrator.getWorkflow(workflowId);
    }

    public List<AgentRecord> agents() {
        return bus.agentRecords();
    }

    public AuditLogger.VerifyResult verifyAudit() {
        return auditLogger.verify();
    }

    private void registerBuiltIns() {
        register(new EchoAgent());
        register(new FailAgent());
        for (MeshSettings.ScriptAgentSpec spec : settings.scriptAgents()) {
            if (spec.id() == null || spec.id().isBlank() || spec.command().isEmpty()) {
                log.warn("Skipping script agent with missing id or command: {}", spec.id());
                continue;
            }
            Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
            for (String tag : spec.capabilities()) {
                capabilities.add(Capability.fromString(tag));
            }
            if (capabilities.isEmpty()) {
                capabilities.add(Capability.SYSTEM_OPERATIONS);
            }
            long timeoutMs = spec.timeoutMs() == null ? settings.defaultTimeoutMs() : spec.timeoutMs();
            register(new ScriptAgent(spec.id(), capabilities, spec.command(), timeoutMs));
        }
    }

    private static WorkflowStore createStore(AgentMeshConfig config, MeshSettings settings) {
        if (MeshSettings.STORE_SQLITE.equals(settings.workflowStore())) {
            Database database = new Database(config);
            database.init();
            return new JdbcWorkflowStore(database, settings.workflowRetention());
        }
        return new InMemoryWorkflowStore(settings.workflowRetention());
    }

    private static List<String> capabilityTags(Set<Capability> capabilities) {
        return capabilities.stream().map(Capability::tag).sorted().toList();
    }

    @Override
    public void close() {
        orchestrator.close();
        bus.close();
        store.close();
    }
}
