package com.mimecast.wren.worker;

/**
 * Worker lifecycle states.
 *
 * <p>STARTING -&gt; RUNNING -&gt; DRAINING -&gt; STOPPED.
 * <br>A worker failing configuration validation goes from STARTING straight to STOPPED.
 */
public enum WorkerState {
    STARTING,
    RUNNING,
    DRAINING,
    STOPPED
}
