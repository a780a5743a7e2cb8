package com.banana.integration.gemini;

import com.banana.core.batch.GenerationTask;
import com.banana.core.batch.GenerationTaskFactory;
import com.banana.core.model.GenerationRequest;
import com.banana.core.request.ReferenceImage;
import com.banana.core.request.ReferenceImageLoader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One Gemini call per worker. Reference images are loaded inside the worker, not on the caller's thread.
 */
public final class GeminiTaskFactory implements GenerationTaskFactory {

    private final GeminiImageClient client;
    private final ReferenceImageLoader loader;

    public GeminiTaskFactory(GeminiImageClient client) {
        this(client, new ReferenceImageLoader());
    }

    public GeminiTaskFactory(GeminiImageClient client, ReferenceImageLoader loader) {
        this.client = Objects.requireNonNull(client, "client");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    @Override
    public GenerationTask create(GenerationRequest request, int workerIndex) {
        return status -> {
            List<ReferenceImage> images = new ArrayList<>();
            if (request.mode().usesReferenceImages()) {
                status.accept("Preparing " + request.imageRefs().size() + " reference image(s)");
                for (Path ref : request.imageRefs()) {
                    images.add(loader.load(ref));
                }
            }
            return client.generate(request, images, status);
        };
    }
}
