package io.mnemo.cli;

import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.extraction.MemoryExtractionService;

@FunctionalInterface
public interface ServiceFactory {
    MemoryExtractionService create(MnemoConfig config);
}
