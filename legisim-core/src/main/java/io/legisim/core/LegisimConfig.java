package io.legisim.core;

/// Configuration options for the sweep execution environment.
///
/// Controls the size of the worker pool that runs independent sweep values.
/// Use the {@link Builder} for fluent configuration or construct directly
/// with setters for mutable configuration.
///
/// ### Default Values
/// - `threadPoolSize`: number of available processors
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended
/// to be configured before passing to {@link io.legisim.core.sweep.SweepDriver}.
/// Do not modify after the driver is created.
///
/// @see io.legisim.core.sweep.SweepDriver
/// @see Builder
public class LegisimConfig {
    private int threadPoolSize = Runtime.getRuntime().availableProcessors();

    /// Creates a configuration with default values.
    public LegisimConfig() {}

    /// Returns the number of worker threads used for sweeps.
    ///
    /// @return the fixed thread pool size
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the number of worker threads used for sweeps.
    ///
    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    ///
    /// @param threadPoolSize the number of threads in the fixed pool, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link LegisimConfig} instances.
    public static class Builder {
        private final LegisimConfig config = new LegisimConfig();

        /// Sets the number of worker threads.
        ///
        /// @param threadPoolSize the number of threads, must be positive
        /// @return this builder for chaining, never null
        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        /// Builds and returns the configured {@link LegisimConfig} instance.
        ///
        /// @return the configured instance, never null
        public LegisimConfig build() {
            return config;
        }
    }
}
