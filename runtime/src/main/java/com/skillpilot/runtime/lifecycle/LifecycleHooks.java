package com.skillpilot.runtime.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered callbacks fired after lifecycle mutations.
 *
 * Hooks run synchronously, in registration order, after the state change has
 * been committed. A throwing load/unload hook does not undo the change; the
 * manager reports it to the error hooks instead.
 */
public class LifecycleHooks {

    private static final Logger log = LoggerFactory.getLogger(LifecycleHooks.class);

    @FunctionalInterface
    public interface LoadHook {
        void onLoad(String skillName, String content) throws Exception;
    }

    @FunctionalInterface
    public interface UnloadHook {
        void onUnload(String skillName) throws Exception;
    }

    @FunctionalInterface
    public interface ErrorHook {
        void onError(String skillName, Exception error) throws Exception;
    }

    /** A hook that threw, reported back to the manager. */
    public record HookFailure(String hook, Exception error) {}

    private final List<LoadHook>   onLoad   = new CopyOnWriteArrayList<>();
    private final List<UnloadHook> onUnload = new CopyOnWriteArrayList<>();
    private final List<ErrorHook>  onError  = new CopyOnWriteArrayList<>();

    public void addLoadHook(LoadHook hook)     { onLoad.add(hook); }
    public void addUnloadHook(UnloadHook hook) { onUnload.add(hook); }
    public void addErrorHook(ErrorHook hook)   { onError.add(hook); }

    List<HookFailure> fireLoad(String skillName, String content) {
        List<HookFailure> failures = new ArrayList<>();
        for (LoadHook hook : onLoad) {
            try {
                hook.onLoad(skillName, content);
            } catch (Exception e) {
                failures.add(new HookFailure("on_load", e));
            }
        }
        return failures;
    }

    List<HookFailure> fireUnload(String skillName) {
        List<HookFailure> failures = new ArrayList<>();
        for (UnloadHook hook : onUnload) {
            try {
                hook.onUnload(skillName);
            } catch (Exception e) {
                failures.add(new HookFailure("on_unload", e));
            }
        }
        return failures;
    }

    void fireError(String skillName, Exception error) {
        for (ErrorHook hook : onError) {
            try {
                hook.onError(skillName, error);
            } catch (Exception e) {
                log.warn("Error hook failed for skill '{}': {}", skillName, e.getMessage(), e);
            }
        }
    }
}
