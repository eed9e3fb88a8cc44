/**
 * Runtime wiring package.
 *
 * <p>{@link io.fleetmesh.runtime.FleetMeshRuntime} builds one namespace's stores
 * and services and hands them to the CLI, the admin API and the agent endpoint.
 */
package io.fleetmesh.runtime;
