package com.banana.core.batch;

import com.banana.core.model.GenerationRequest;

@FunctionalInterface
public interface GenerationTaskFactory {

    GenerationTask create(GenerationRequest request, int workerIndex);
}
