/**
 * FleetMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.fleetmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.fleetmesh.cli.FleetMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.fleetmesh.runtime.FleetMeshRuntime} wires keys, ingestion, scheduling and links.</li>
 *   <li>{@code io.fleetmesh.storage} holds every cross-process invariant as a SQLite constraint or conditional update.</li>
 * </ul>
 */
package io.fleetmesh;
