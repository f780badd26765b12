package me.golemcore.context.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User-editable settings persisted in {@code preferences/engine-settings.json}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EngineSettings {

    private ContextEngineConfig context;
    private MemoryAutoUpgradeConfig autoUpgrade;
    private MemoryCleanupConfig cleanup;
}
