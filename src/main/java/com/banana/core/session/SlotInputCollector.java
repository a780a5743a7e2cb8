package com.banana.core.session;

import com.banana.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Input-side collaborator of {@link SlotSessionManager}: validates incoming paths and applies
 * the caller's policy for a full session. Drops use {@link FullSlotPolicy#REJECT}; pastes
 * use {@link FullSlotPolicy#REPLACE_FIRST}.
 */
public final class SlotInputCollector {
    private static final Logger LOGGER = AppLogger.get();

    public enum FullSlotPolicy {
        REJECT,
        REPLACE_FIRST
    }

    private final SlotSessionManager session;
    private final ImagePathValidator validator;

    public SlotInputCollector(SlotSessionManager session, ImagePathValidator validator) {
        this.session = Objects.requireNonNull(session, "session");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public SlotAddResult add(String path, FullSlotPolicy policy) {
        Optional<String> rejection = validator.rejectionReason(path);
        if (rejection.isPresent()) {
            LOGGER.info("Image rejected (" + rejection.get() + "): " + path);
            return SlotAddResult.REJECTED;
        }
        if (session.addToNextAvailable(path)) {
            return SlotAddResult.ADDED;
        }
        if (policy == FullSlotPolicy.REPLACE_FIRST) {
            session.replaceAt(0, path);
            LOGGER.info("All slots full, replaced slot 1 with " + path);
            return SlotAddResult.REPLACED_FIRST;
        }
        return SlotAddResult.SLOT_FULL;
    }

    public AddReport addAll(List<String> paths, FullSlotPolicy policy) {
        List<String> added = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String path : paths) {
            SlotAddResult result = add(path, policy);
            switch (result) {
                case ADDED, REPLACED_FIRST -> added.add(path);
                case REJECTED -> rejected.add(path);
                case SLOT_FULL -> skipped.add(path);
            }
        }
        if (!skipped.isEmpty()) {
            LOGGER.warning("Added %d/%d images, slots full".formatted(added.size(), paths.size()));
        }
        return new AddReport(added, rejected, skipped);
    }

    /**
     * @param added    paths now held by a slot
     * @param rejected paths that failed validation
     * @param skipped  valid paths that found no free slot
     */
    public record AddReport(List<String> added, List<String> rejected, List<String> skipped) {
        public AddReport {
            added = List.copyOf(added);
            rejected = List.copyOf(rejected);
            skipped = List.copyOf(skipped);
        }

        public boolean allAdded() {
            return rejected.isEmpty() && skipped.isEmpty();
        }
    }
}
