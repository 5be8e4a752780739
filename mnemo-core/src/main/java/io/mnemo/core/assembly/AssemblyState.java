package io.mnemo.core.assembly;

public enum AssemblyState {
    COLLECTING,
    COMPLETE,
    TRUNCATED,
    ERRORED
}
