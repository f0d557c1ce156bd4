package io.agentmesh.cli;

import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.dispatch.DispatchResult;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.model.WorkflowView;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.runtime.AgentMeshRuntime;
import io.agentmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "agentmesh",
        mixinStandardHelpOptions = true,
        description = "AgentMesh multi-agent dispatcher CLI",
        subcommands = {
                AgentMeshCommand.AskCommand.class,
                AgentMeshCommand.WorkflowsCommand.class,
                AgentMeshCommand.WorkflowCommand.class,
                AgentMeshCommand.AgentsCommand.class,
                AgentMeshCommand.AuditVerifyCommand.class
        }
)
public final class AgentMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: ask | workflows | workflow | agents | audit-verify");
    }

    AgentMeshRuntime runtime() {
        AgentMeshConfig config = AgentMeshConfig.fromRoot(root);
        MeshSettings settings = MeshSettings.load(config.settingsFile()).withWorkflowStore(MeshSettings.STORE_SQLITE);
        return new AgentMeshRuntime(config, settings);
    }

    @Command(name = "ask", description = "Dispatch a query: direct answer, one agent, or a workflow")
    static final class AskCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--agent"}, description = "Send straight to this agent id")
        String agent;

        @Parameters(arity = "1..*", description = "Query text")
        List<String> words;

        @Override
        public Integer call() {
            Map<String, Object> context = new LinkedHashMap<>();
            if (agent != null && !agent.isBlank()) {
                context.put("target_agent", agent.trim());
            }
            try (AgentMeshRuntime runtime = parent.runtime()) {
                DispatchResult result = runtime.ask(String.join(" ", words), context);
                System.out.println(Jsons.toJson(result));
                return result.error() ? 2 : 0;
            }
        }
    }

    @Command(name = "workflows", description = "List recorded workflows, most recent first")
    static final class WorkflowsCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--status"}, description = "Filter by status: planning|running|completed|failed|partial")
        String status;

        @Override
        public Integer call() {
            WorkflowStatus filter = status == null || status.isBlank() ? null : WorkflowStatus.fromString(status);
            try (AgentMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.workflows(filter)));
                return 0;
            }
        }
    }

    @Command(name = "workflow", description = "Show a workflow with its subtasks and history")
    static final class WorkflowCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Parameters(index = "0", description = "Workflow id")
        String workflowId;

        @Override
        public Integer call() {
            try (AgentMeshRuntime runtime = parent.runtime()) {
                Optional<WorkflowView> workflow = runtime.workflow(workflowId);
                if (workflow.isEmpty()) {
                    System.out.println("{\"error\":\"workflow not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(workflow.get()));
                return 0;
            }
        }
    }

    @Command(name = "agents", description = "List registered agents with state and success rate")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() {
            try (AgentMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.agents()));
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() {
            try (AgentMeshRuntime runtime = parent.runtime()) {
                AuditLogger.VerifyResult result = runtime.verifyAudit();
                System.out.println(Jsons.toJson(result));
                return result.valid() ? 0 : 1;
            }
        }
    }
}
