/**
 * Runtime wiring package.
 *
 * <p>{@link io.agentmesh.runtime.AgentMeshRuntime} builds the bus, orchestrator, dispatcher,
 * workflow store and audit trail from configuration, and is what the CLI talks to.
 */
package io.agentmesh.runtime;
