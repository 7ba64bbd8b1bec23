package com.skillpilot.runtime.lifecycle;

public enum LifecycleEventType {
    LOAD,
    LOAD_ERROR,
    UNLOAD,
    ACTIVATE,
    DEACTIVATE,
    UPGRADE,
    UPGRADE_ERROR,
    HOOK_ERROR
}
