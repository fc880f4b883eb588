package dev.containerizer.agent.containerizer;

/**
 * What recovery does with containers that carry our name prefix but have no checkpointed run.
 */
public enum OrphanPolicy {
    /** Log them and leave them running. */
    LEAVE,
    /** Stop and remove them. */
    DESTROY
}
