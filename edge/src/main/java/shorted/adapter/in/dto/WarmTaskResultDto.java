package shorted.adapter.in.dto;

import java.util.Optional;

import shorted.core.model.cache.WarmResult;

/**
 * Outcome of one warm task as reported by the warm-cache endpoint.
 */
public record WarmTaskResultDto(boolean success, Optional<String> error) {

    public static WarmTaskResultDto fromModel(WarmResult result) {
        return new WarmTaskResultDto(result.success(), result.error());
    }
}
