package com.codeforge.orchestrator.pipeline;

import com.codeforge.orchestrator.agent.CancellationToken;
import com.codeforge.orchestrator.checkpoint.CheckpointStore;
import com.codeforge.orchestrator.llm.ResilientTextGenerator;
import com.codeforge.orchestrator.llm.TextGenerationClient;
import com.codeforge.orchestrator.llm.TextGenerationClients;
import com.codeforge.orchestrator.sandbox.SandboxedFileGateway;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assembles a {@link PipelineStateMachine} for one run from its
 * {@link RunConfig}: the sandbox for the project root, the provider's client
 * wrapped with timeout and retry, and the stage handlers.
 */
@Component
public class PipelineFactory {

    private final List<StageHandler>    stageHandlers;
    private final CheckpointStore       checkpointStore;
    private final TextGenerationClients clients;
    private final MeterRegistry         meterRegistry;

    public PipelineFactory(List<StageHandler> stageHandlers,
                           CheckpointStore checkpointStore,
                           TextGenerationClients clients,
                           MeterRegistry meterRegistry) {
        this.stageHandlers   = stageHandlers;
        this.checkpointStore = checkpointStore;
        this.clients         = clients;
        this.meterRegistry   = meterRegistry;
    }

    public PipelineStateMachine create(RunConfig config, CancellationToken cancellation) {
        TextGenerationClient generator = new ResilientTextGenerator(clients.forProvider(config.provider()),
                config.llmTimeout(), config.llmMaxAttempts(), config.llmBackoffMillis());
        SandboxedFileGateway gateway = new SandboxedFileGateway(config.projectRoot());
        return new PipelineStateMachine(config, stageHandlers, checkpointStore, generator, gateway,
                cancellation, meterRegistry);
    }

    public CheckpointStore checkpointStore() {
        return checkpointStore;
    }
}
