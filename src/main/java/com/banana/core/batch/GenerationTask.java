package com.banana.core.batch;

import java.util.List;
import java.util.function.Consumer;

/**
 * One unit of remote generation work, run on its own worker thread.
 */
@FunctionalInterface
public interface GenerationTask {

    /**
     * @param status receives free-text progress messages
     * @return generated images, possibly empty; an empty list counts as a failed worker
     * @throws Exception any failure; the message is kept as the worker's error
     */
    List<byte[]> generate(Consumer<String> status) throws Exception;
}
