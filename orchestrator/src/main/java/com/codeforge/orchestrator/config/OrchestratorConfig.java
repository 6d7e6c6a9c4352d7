package com.codeforge.orchestrator.config;

import com.codeforge.orchestrator.checkpoint.CheckpointStore;
import com.codeforge.orchestrator.checkpoint.FileCheckpointStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class OrchestratorConfig {

    @Bean
    public CheckpointStore checkpointStore(@Value("${codeforge.checkpoint-dir:checkpoints}") String dir,
                                           ObjectMapper objectMapper) {
        return new FileCheckpointStore(Path.of(dir), objectMapper);
    }
}
