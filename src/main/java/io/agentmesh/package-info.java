/**
 * AgentMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentmesh.cli.AgentMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.agentmesh.dispatch.Dispatcher} routes a query: direct, one agent, or a workflow.</li>
 *   <li>{@code io.agentmesh.bus.MessageBus} delivers messages with timeouts and retries.</li>
 *   <li>{@code io.agentmesh.orchestrator.Orchestrator} plans and runs multi-step workflows.</li>
 * </ul>
 */
package io.agentmesh;
