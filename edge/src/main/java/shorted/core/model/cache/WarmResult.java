package shorted.core.model.cache;

import java.util.Optional;

/**
 * Outcome of a single warm task.
 *
 * @param name the task name
 * @param success whether the entry was written
 * @param error failure message when not successful
 */
public record WarmResult(String name, boolean success, Optional<String> error) {

    public static WarmResult ok(String name) {
        return new WarmResult(name, true, Optional.empty());
    }

    public static WarmResult failed(String name, String error) {
        return new WarmResult(name, false, Optional.ofNullable(error).or(() -> Optional.of("unknown error")));
    }
}
