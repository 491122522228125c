package domain.model;

/**
 * Sink for warnings, so loaders and the batch loop can report without depending on the
 * report writer.
 */
public interface WarningSink {

    static WarningSink none() {
        return NullWarningSink.INSTANCE;
    }

    void warn(FingerprintWarning warning);
}
