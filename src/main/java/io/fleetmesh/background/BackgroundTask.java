package io.fleetmesh.background;

@FunctionalInterface
public interface BackgroundTask<T> {
    T run(TaskContext context) throws Exception;
}
