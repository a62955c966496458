package home.heating.model;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public class PinStatus {
    private final String name;
    private final @Nullable Boolean requestedState;
    private final @Nullable Boolean actualState;
    private final @Nullable PinRequest activeRequest;
    private final List<PinRequest> requests;
    private final @Nullable String lastError;

    public PinStatus(
        String name,
        @Nullable Boolean requestedState,
        @Nullable Boolean actualState,
        @Nullable PinRequest activeRequest,
        List<PinRequest> requests,
        @Nullable String lastError
    ) {
        this.name = name;
        this.requestedState = requestedState;
        this.actualState = actualState;
        this.activeRequest = activeRequest;
        this.requests = requests;
        this.lastError = lastError;
    }

    public String getName() {
        return name;
    }

    /**
     * @return последнее записанное в реле состояние, null если записей еще не было
     */
    public @Nullable Boolean getRequestedState() {
        return requestedState;
    }

    /**
     * @return прочитанное состояние реле, null если опрос не удался
     */
    public @Nullable Boolean getActualState() {
        return actualState;
    }

    public @Nullable PinRequest getActiveRequest() {
        return activeRequest;
    }

    public List<PinRequest> getRequests() {
        return requests;
    }

    public @Nullable String getLastError() {
        return lastError;
    }

    /**
     * Реле не в том состоянии, которое в него записывали, или его не удалось прочитать
     */
    public boolean hasDiscrepancy() {
        if (requestedState == null) {
            return false;
        }
        return actualState == null || !actualState.equals(requestedState);
    }
}
