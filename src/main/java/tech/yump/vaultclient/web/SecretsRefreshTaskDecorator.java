package tech.yump.vaultclient.web;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import tech.yump.vaultclient.service.ConfigManager;

import java.util.Map;

/**
 * Refreshes managed secrets before each task run by an executor, carrying over the
 * submitting thread's MDC. A failed refresh fails the task.
 */
@Slf4j
public class SecretsRefreshTaskDecorator implements TaskDecorator {

    private final boolean enabled;
    @Nullable
    private final ConfigManager configManager;

    public SecretsRefreshTaskDecorator(boolean enabled, @Nullable ConfigManager configManager) {
        this.enabled = enabled && configManager != null;
        this.configManager = configManager;
    }

    public static SecretsRefreshTaskDecorator disabled() {
        return new SecretsRefreshTaskDecorator(false, null);
    }

    @Override
    @NonNull
    public Runnable decorate(@NonNull Runnable runnable) {
        if (!enabled) {
            return runnable;
        }
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                log.trace("Refreshing secrets before running task.");
                configManager.update();
                runnable.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
