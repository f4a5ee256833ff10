package io.github.jakubt4.lumen.instrument;

/**
 * Lifecycle of a channel: created {@link #UNBUILT}, then either {@link #BUILT} from its
 * description or {@link #LOADED} from a persisted table and artifacts.
 */
public enum InstrumentState {
    UNBUILT,
    BUILT,
    LOADED;

    /**
     * @throws InstrumentStateException unless the channel can still be built
     */
    void requireBuildable(final String channel) {
        switch (this) {
            case UNBUILT -> {
            }
            case BUILT -> throw new InstrumentStateException("channel [" + channel + "] is already built");
            case LOADED -> throw new InstrumentStateException(
                    "channel [" + channel + "] was loaded from a persisted state and cannot be rebuilt");
        }
    }

    boolean isReady() {
        return this != UNBUILT;
    }
}
