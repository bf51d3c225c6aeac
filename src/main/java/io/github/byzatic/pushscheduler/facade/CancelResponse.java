package io.github.byzatic.pushscheduler.facade;

public final class CancelResponse {
    public final String id;
    public final String status;
    public final String message;

    CancelResponse(String id, String status, String message) {
        this.id = id;
        this.status = status;
        this.message = message;
    }
}
