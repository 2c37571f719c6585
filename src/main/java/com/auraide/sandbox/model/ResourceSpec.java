package com.auraide.sandbox.model;

/**
 * CPU cores, memory (MB) and storage (MB). Any field may be null in a request,
 * meaning "use the provider default" or "leave unchanged".
 */
public record ResourceSpec(Double cpu, Long memory, Long storage) {

    public ResourceSpec orDefaults(double defaultCpu, long defaultMemory, long defaultStorage) {
        return new ResourceSpec(
                cpu != null ? cpu : defaultCpu,
                memory != null ? memory : defaultMemory,
                storage != null ? storage : defaultStorage);
    }

    public ResourceSpec mergedWith(ResourceSpec update) {
        if (update == null) {
            return this;
        }
        return new ResourceSpec(
                update.cpu() != null ? update.cpu() : cpu,
                update.memory() != null ? update.memory() : memory,
                update.storage() != null ? update.storage() : storage);
    }
}
